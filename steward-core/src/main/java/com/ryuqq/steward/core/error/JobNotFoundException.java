package com.ryuqq.steward.core.error;

import com.ryuqq.steward.core.model.JobId;

/**
 * Ticket이 가리키는 Job이 없거나 보존 기간이 지나 만료됨.
 *
 * @author Steward Team
 * @since 1.0.0
 */
public class JobNotFoundException extends StewardException {

    public static final String ERROR_CODE = "JOB-404";

    private final JobId jobId;

    public JobNotFoundException(JobId jobId) {
        super(ERROR_CODE, "Job not found or expired: " + (jobId == null ? null : jobId.getValue()));
        this.jobId = jobId;
    }

    public JobId getJobId() {
        return jobId;
    }
}

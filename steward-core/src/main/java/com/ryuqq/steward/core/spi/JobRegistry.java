package com.ryuqq.steward.core.spi;

import com.ryuqq.steward.core.error.JobNotFoundException;
import com.ryuqq.steward.core.job.Job;
import com.ryuqq.steward.core.model.JobId;

import java.util.List;

/**
 * Process-wide Job registry SPI.
 *
 * <p>Owns the Job lifecycle: registration at submit, termination when the
 * orchestration finishes, and expiry after a retention window.</p>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * register(job)   → active
 * terminate(id)   → detached from active tracking, still resolvable
 * (retention)     → expired, find(id) throws JobNotFoundException
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Single writer: all mutation serialised so concurrent register/find/remove never race</li>
 *   <li>Expired entries must never be returned by {@link #find(JobId)}</li>
 * </ul>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public interface JobRegistry {

    /**
     * Registers a Job.
     *
     * @param job the job
     * @return the ticket id (the job id)
     * @throws IllegalArgumentException if job is null
     * @throws IllegalStateException if a job with the same id is already registered
     */
    JobId register(Job job);

    /**
     * Finds a registered, non-expired Job.
     *
     * @param id the job id
     * @return the job
     * @throws JobNotFoundException if unknown or expired
     */
    Job find(JobId id);

    /**
     * Removes a Job immediately.
     *
     * @param id the job id
     * @return true if removed
     */
    boolean remove(JobId id);

    /**
     * Detaches a Job from active tracking and starts its retention window.
     *
     * @param id the job id
     * @return true if the job was active and is now terminated, false otherwise
     */
    boolean terminate(JobId id);

    /**
     * Lists Jobs that have not been terminated yet.
     *
     * @return active jobs
     */
    List<Job> active();

    /**
     * Removes every terminated Job whose retention window has elapsed.
     *
     * @return number of removed jobs
     */
    int purgeExpired();

    /**
     * Number of Jobs currently resolvable (active and retained).
     *
     * @return registry size
     */
    int size();
}

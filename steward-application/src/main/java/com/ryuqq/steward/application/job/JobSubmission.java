package com.ryuqq.steward.application.job;

import com.ryuqq.steward.core.job.Job;
import com.ryuqq.steward.core.job.Ticket;

/**
 * 제출 결과: 실행 측이 진행을 보고할 Job과 호출자에게 돌려줄 Ticket.
 *
 * @param job 등록된 Job (Orchestrator 전용)
 * @param ticket 호출자용 핸들
 *
 * @author Steward Team
 * @since 1.0.0
 */
public record JobSubmission(Job job, Ticket ticket) {

    public JobSubmission {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        if (ticket == null) {
            throw new IllegalArgumentException("ticket cannot be null");
        }
    }
}

package com.ryuqq.steward.application.job;

import com.ryuqq.steward.core.error.JobNotFoundException;
import com.ryuqq.steward.core.job.Job;
import com.ryuqq.steward.core.job.JobKind;
import com.ryuqq.steward.core.job.JobSnapshot;
import com.ryuqq.steward.core.job.Ticket;
import com.ryuqq.steward.core.model.JobId;
import com.ryuqq.steward.core.spi.JobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Job 생성 및 종료 관리자.
 *
 * <p>제출 시 QUEUED Job을 생성하여 {@link JobRegistry}에 등록하고, 즉시 Ticket을 반환합니다.
 * 오케스트레이션이 끝나면 {@link #terminate(Job)}로 활성 추적에서 분리하며,
 * 이후 Ticket은 보존 기간 동안 마지막 상태로 해석됩니다.</p>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public class JobManager {

    private static final Logger log = LoggerFactory.getLogger(JobManager.class);

    private final JobRegistry registry;
    private final Clock clock;

    public JobManager(JobRegistry registry, Clock clock) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * 새 Job 제출.
     *
     * @param kind Job 종류
     * @return Job과 Ticket
     */
    public JobSubmission submit(JobKind kind) {
        Job job = Job.create(kind, clock);
        JobId id = registry.register(job);
        log.debug("Job submitted: id={}, kind={}", id.getValue(), kind);
        return new JobSubmission(job, new Ticket(id, registry));
    }

    /**
     * Job을 활성 추적에서 분리 (보존 기간 시작).
     *
     * <p>종료 상태가 아닌 Job도 분리할 수 있지만, 그 경우 경고를 남깁니다.</p>
     *
     * @param job 대상 Job
     */
    public void terminate(Job job) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        if (!job.isTerminal()) {
            log.warn("Terminating non-terminal job: {}", job);
        }
        registry.terminate(job.getId());
    }

    /**
     * 기존 Job에 대한 Ticket 조회.
     *
     * @param id Job ID
     * @return Ticket
     * @throws JobNotFoundException Job이 없거나 만료된 경우
     */
    public Ticket ticket(JobId id) {
        registry.find(id);
        return new Ticket(id, registry);
    }

    /**
     * 아직 종료 처리되지 않은 Job 스냅샷 목록.
     *
     * @return 활성 Job 스냅샷
     */
    public List<JobSnapshot> active() {
        return registry.active().stream()
            .map(Job::snapshot)
            .toList();
    }
}

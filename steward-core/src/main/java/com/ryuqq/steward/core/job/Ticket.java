package com.ryuqq.steward.core.job;

import com.ryuqq.steward.core.error.JobNotFoundException;
import com.ryuqq.steward.core.model.JobId;
import com.ryuqq.steward.core.spi.JobRegistry;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 호출자가 보유하는 Job 핸들.
 *
 * <p>Ticket은 Job 데이터를 소유하지 않으며, 매번 {@link JobRegistry}를 통해 해석됩니다.
 * Job 수명과 보존 기간 동안 유효하며, 그 이후에는 {@link JobNotFoundException}이 발생합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Ticket ticket = orchestrator.configure(request);
 *
 * // 비블로킹 조회
 * JobSnapshot snapshot = ticket.poll();
 *
 * // 종료까지 대기
 * FinalStatus status = ticket.await();
 * if (!status.isSuccess()) {
 *     log.warn("{} failed on {} nodes", status.jobId(), status.failureCount());
 * }
 * </pre>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public final class Ticket {

    private final JobId jobId;
    private final JobRegistry registry;

    /**
     * 생성자.
     *
     * @param jobId 참조할 Job ID
     * @param registry Job 해석에 사용할 레지스트리
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public Ticket(JobId jobId, JobRegistry registry) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.jobId = jobId;
        this.registry = registry;
    }

    public JobId getJobId() {
        return jobId;
    }

    /**
     * 현재 상태 조회 (비블로킹).
     *
     * @return 현재 스냅샷
     * @throws JobNotFoundException Job이 없거나 만료된 경우
     */
    public JobSnapshot poll() {
        return registry.find(jobId).snapshot();
    }

    /**
     * Job이 종료될 때까지 대기.
     *
     * @return 최종 상태
     * @throws JobNotFoundException Job이 없거나 만료된 경우
     * @throws RuntimeException 대기 중 인터럽트 발생 시
     */
    public FinalStatus await() {
        Job job = registry.find(jobId);
        try {
            return job.completion().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while awaiting " + jobId, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Job completion failed unexpectedly: " + jobId, e.getCause());
        }
    }

    /**
     * 최대 timeout 동안 Job 종료를 대기.
     *
     * @param timeout 최대 대기 시간
     * @return 최종 상태, 시간 내 종료되지 않으면 empty
     * @throws JobNotFoundException Job이 없거나 만료된 경우
     * @throws RuntimeException 대기 중 인터럽트 발생 시
     */
    public Optional<FinalStatus> await(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative");
        }
        Job job = registry.find(jobId);
        try {
            return Optional.of(job.completion().get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while awaiting " + jobId, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Job completion failed unexpectedly: " + jobId, e.getCause());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Ticket ticket = (Ticket) o;
        return jobId.equals(ticket.jobId);
    }

    @Override
    public int hashCode() {
        return jobId.hashCode();
    }

    @Override
    public String toString() {
        return "Ticket{" + jobId.getValue() + '}';
    }
}

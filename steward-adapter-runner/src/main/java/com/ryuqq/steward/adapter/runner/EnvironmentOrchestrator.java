package com.ryuqq.steward.adapter.runner;

import com.ryuqq.steward.application.job.JobManager;
import com.ryuqq.steward.application.job.JobSubmission;
import com.ryuqq.steward.application.lock.DistributedLock;
import com.ryuqq.steward.application.orchestrator.LifecycleOperation;
import com.ryuqq.steward.application.orchestrator.Orchestrator;
import com.ryuqq.steward.core.error.ResourceNotFoundException;
import com.ryuqq.steward.core.job.Job;
import com.ryuqq.steward.core.job.JobResult;
import com.ryuqq.steward.core.job.Ticket;
import com.ryuqq.steward.core.lock.LockConflictException;
import com.ryuqq.steward.core.model.OwnerId;
import com.ryuqq.steward.core.model.ResourceId;
import com.ryuqq.steward.core.model.UnitId;
import com.ryuqq.steward.core.request.OrchestrationRequest;
import com.ryuqq.steward.core.resource.Resource;
import com.ryuqq.steward.core.spi.ResourceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 환경 수명주기 작업을 실행하는 Orchestrator 구현체.
 *
 * <p>제출된 요청마다 Job을 만들고 즉시 Ticket을 반환한 뒤, Job 워커 풀에서 다음을 실행합니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * 1. 대상 환경 조회 (없으면 FAILURE, RESOURCE-404)
 * 2. markRunning("Finding environment &lt;id&gt;") → runExclusive(환경, identity, force)
 *    - 다른 소유자가 보유 중이면 FAILURE (LOCK-409), 아무 작업도 하지 않음
 * 3. (configure / bootstrap) 요청 속성을 깊은 병합 후 저장 (롤백 없음)
 * 4. 멤버 유닛 조회
 * 5. 유닛마다 작업 하나씩 동시 실행 (UnitFanOut)
 * 6. 전부 join
 * 7. 집계: 실패 0 → SUCCESS, 그 외 → FAILURE (카운트 + 실패 유닛)
 *    (destroy) 전원 성공이면 락 보유 중 환경 삭제
 * 8. 그 밖의 예외 → FAILURE (원인 기록)
 * 9. finally: Job 활성 추적 해제 (락은 runExclusive가 해제)
 * </pre>
 *
 * <p><strong>오류 전달:</strong> 어떤 예외도 Ticket 경계를 넘지 않습니다.
 * 모든 결과는 Job의 종료 상태와 {@code JobResult}로 전달됩니다.</p>
 *
 * <p><strong>종료:</strong> {@link #shutdown()}은 새 요청을 거부하고, 실행 중 Job을 기다린 뒤
 * 이 프로세스가 보유한 모든 락을 해제합니다. 시작하지 못한 Job은 FAILURE로 종료됩니다.</p>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public final class EnvironmentOrchestrator implements Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentOrchestrator.class);

    private final DistributedLock lock;
    private final JobManager jobManager;
    private final ResourceRepository repository;
    private final UnitFanOut fanOut;
    private final ExecutorService jobPool;
    private final OrchestratorConfig config;
    private final OwnerId identity;

    private volatile boolean shutdown = false;

    static final String SHUTDOWN_MESSAGE = "Orchestrator shut down";

    /**
     * 생성자.
     *
     * @param lock 분산 락
     * @param jobManager Job 관리자
     * @param repository 환경 저장소
     * @param fanOut 유닛 팬아웃
     * @param jobPool 오케스트레이션 실행용 워커 풀 (팬아웃 풀과 분리)
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public EnvironmentOrchestrator(
        DistributedLock lock,
        JobManager jobManager,
        ResourceRepository repository,
        UnitFanOut fanOut,
        ExecutorService jobPool,
        OrchestratorConfig config
    ) {
        if (lock == null) {
            throw new IllegalArgumentException("lock cannot be null");
        }
        if (jobManager == null) {
            throw new IllegalArgumentException("jobManager cannot be null");
        }
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (fanOut == null) {
            throw new IllegalArgumentException("fanOut cannot be null");
        }
        if (jobPool == null) {
            throw new IllegalArgumentException("jobPool cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.lock = lock;
        this.jobManager = jobManager;
        this.repository = repository;
        this.fanOut = fanOut;
        this.jobPool = jobPool;
        this.config = config;
        this.identity = OwnerId.of(config.identity());
    }

    @Override
    public Ticket submit(LifecycleOperation operation, OrchestrationRequest request) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        request.validate().orElseThrow();
        if (shutdown) {
            throw new IllegalStateException("Orchestrator is shut down");
        }

        JobSubmission submission = jobManager.submit(operation.jobKind());
        Job job = submission.job();
        log.info("Accepted {} of {}: job={}",
            operation, request.targetResourceId().getValue(), job.getId().getValue());

        try {
            jobPool.execute(new JobTask(operation, request, job));
        } catch (RejectedExecutionException e) {
            log.error("Job pool rejected {}", job, e);
            job.fail(e);
            jobManager.terminate(job);
        }
        return submission.ticket();
    }

    /**
     * 요청 하나를 끝까지 실행하여 Job을 종료 상태로 만듭니다.
     */
    void execute(LifecycleOperation operation, OrchestrationRequest request, Job job) {
        ResourceId resourceId = request.targetResourceId();
        try {
            repository.find(resourceId);
            job.markRunning("Finding environment " + resourceId.getValue());

            FanOutReport report = lock.runExclusive(resourceId, identity, request.force(),
                () -> runLocked(operation, request, job));

            if (report.failureCount() == 0) {
                job.succeed(operation.successMessage(report.total()), report.toJobResult());
                log.info("{} of {} succeeded on {} nodes",
                    operation, resourceId.getValue(), report.total());
            } else {
                job.fail(operation.failureMessage(report.failureCount()), report.toJobResult());
                log.warn("{} of {} failed on {} of {} nodes: {}",
                    operation, resourceId.getValue(), report.failureCount(), report.total(),
                    report.failedUnits());
            }
        } catch (ResourceNotFoundException e) {
            log.warn("{} rejected: {}", operation, e.getMessage());
            job.fail(e);
        } catch (LockConflictException e) {
            log.warn("{} of {} rejected: {}", operation, resourceId.getValue(), e.getMessage());
            job.fail(e);
        } catch (RuntimeException e) {
            log.error("{} of {} failed unexpectedly", operation, resourceId.getValue(), e);
            job.fail(e);
        } finally {
            jobManager.terminate(job);
        }
    }

    private FanOutReport runLocked(LifecycleOperation operation, OrchestrationRequest request, Job job) {
        ResourceId resourceId = request.targetResourceId();

        // re-read under the lock
        Resource resource = repository.find(resourceId);

        if (operation.persistsAttributes()) {
            job.setStatus("Saving updated environment");
            resource = resource.mergeAttributes(request.attributes());
            if (!repository.persist(resource)) {
                throw new IllegalStateException("Failed to save environment " + resourceId.getValue());
            }
        }

        job.setStatus("Searching for nodes in the environment");
        List<UnitId> units = repository.listMembers(resource);

        job.setStatus("Performing a " + operation.unitOperation().verb() + " on " + units.size() + " nodes");
        FanOutReport report = fanOut.run(units, operation.unitOperation());

        if (operation.deletesOnSuccess() && report.failureCount() == 0) {
            job.setStatus("Deleting environment " + resourceId.getValue());
            if (!repository.delete(resourceId)) {
                throw new IllegalStateException("Failed to delete environment " + resourceId.getValue());
            }
            log.info("Environment deleted: {}", resourceId.getValue());
        }
        return report;
    }

    /**
     * Orchestrator 종료.
     *
     * <p><strong>종료 순서:</strong></p>
     * <pre>
     * 1. 새 요청 거부, Job 워커 풀 shutdown
     * 2. 실행 중 Job을 최대 shutdownTimeoutMs 동안 대기
     * 3. 시간 초과 시 shutdownNow: 시작하지 못한 Job은 FAILURE로 종료 (INTERNAL-500)
     *    → 남은 Job을 다시 최대 shutdownTimeoutMs 동안 대기
     * 4. 모든 Job이 끝났을 때만 이 identity로 보유한 락을 해제
     * </pre>
     *
     * <p>실행 중인 Job이 남아 있으면 락을 해제하지 않습니다. 그 락은 해당 Job의
     * runExclusive가 유닛 작업을 모두 join한 뒤 해제합니다.</p>
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        if (shutdown) {
            return;
        }
        shutdown = true;
        jobPool.shutdown();

        long timeout = config.shutdownTimeoutMs();
        if (!jobPool.awaitTermination(timeout, TimeUnit.MILLISECONDS)) {
            log.warn("Job pool did not terminate within {}ms, forcing shutdown", timeout);
            abandon(jobPool.shutdownNow());
            if (!jobPool.awaitTermination(timeout, TimeUnit.MILLISECONDS)) {
                log.warn("Orchestrator {} shut down with jobs still running; their locks stay with them",
                    identity.getValue());
                return;
            }
        }
        lock.releaseHeld(identity);
        log.info("Orchestrator {} shut down", identity.getValue());
    }

    private void abandon(List<Runnable> pending) {
        for (Runnable task : pending) {
            if (task instanceof JobTask jobTask) {
                Job job = jobTask.job;
                job.fail(SHUTDOWN_MESSAGE,
                    JobResult.error(JobResult.INTERNAL_ERROR, "Orchestrator shut down before the job started"));
                jobManager.terminate(job);
                log.warn("Abandoned queued job on shutdown: {}", job);
            }
        }
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public OwnerId getIdentity() {
        return identity;
    }

    /**
     * Job 워커 풀에 제출되는 작업. 강제 종료 시 시작하지 못한 Job을 찾기 위해 Job을 보관합니다.
     */
    private final class JobTask implements Runnable {

        private final LifecycleOperation operation;
        private final OrchestrationRequest request;
        private final Job job;

        private JobTask(LifecycleOperation operation, OrchestrationRequest request, Job job) {
            this.operation = operation;
            this.request = request;
            this.job = job;
        }

        @Override
        public void run() {
            execute(operation, request, job);
        }
    }
}

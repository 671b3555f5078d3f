package com.ryuqq.steward.adapter.runner;

import com.ryuqq.steward.adapter.inmemory.job.InMemoryJobRegistry;
import com.ryuqq.steward.application.job.JobManager;
import com.ryuqq.steward.application.lock.DistributedLock;
import com.ryuqq.steward.application.orchestrator.Orchestrator;
import com.ryuqq.steward.application.resource.EnvironmentCatalog;
import com.ryuqq.steward.core.spi.RecordStore;
import com.ryuqq.steward.core.spi.ResourceRepository;
import com.ryuqq.steward.core.spi.UnitExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 프로세스 단위 구성 루트 (수동 의존성 주입).
 *
 * <p>외부 협력자(레코드 저장소, 환경 저장소, 유닛 실행기)를 받아 코디네이션 계층 전체를 조립합니다.
 * 프로세스 전역 상태(Job 레지스트리, 스레드 풀, 보유 락)는 모두 이 객체가 소유하며
 * {@link #close()}에서 정리됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (StewardContext context = StewardContext.create(StewardConfig.fromSystemProperties(),
 *         recordStore, repository, unitExecutor)) {
 *     context.startReaper();
 *     Ticket ticket = context.orchestrator().configure(request);
 *     FinalStatus status = ticket.await();
 * }
 * </pre>
 *
 * <p><strong>스레드 풀:</strong></p>
 * <ul>
 *   <li>steward-job-N: 오케스트레이션 실행 (jobWorkers 고정)</li>
 *   <li>steward-unit-N: 유닛 작업 팬아웃 (unitConcurrency, 0이면 캐시 풀)</li>
 *   <li>steward-reaper: 만료 Job 정리</li>
 * </ul>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public final class StewardContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StewardContext.class);
    private static final long POOL_SHUTDOWN_TIMEOUT_MS = 5000;

    private final StewardConfig config;
    private final InMemoryJobRegistry jobRegistry;
    private final JobManager jobManager;
    private final DistributedLock lock;
    private final EnvironmentCatalog catalog;
    private final ExecutorService fanOutPool;
    private final EnvironmentOrchestrator orchestrator;
    private final JobReaper reaper;
    private final ScheduledExecutorService reaperScheduler;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private ScheduledFuture<?> reaperTask;

    private StewardContext(
        StewardConfig config,
        RecordStore recordStore,
        ResourceRepository repository,
        UnitExecutor unitExecutor,
        Clock clock
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (recordStore == null) {
            throw new IllegalArgumentException("recordStore cannot be null");
        }
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (unitExecutor == null) {
            throw new IllegalArgumentException("unitExecutor cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;

        log.info("Initializing steward context: identity={}, unitConcurrency={}, jobWorkers={}",
            config.orchestrator().identity(),
            config.orchestrator().isUnboundedFanOut() ? "unbounded" : config.orchestrator().unitConcurrency(),
            config.orchestrator().jobWorkers());

        // Job tracking
        this.jobRegistry = new InMemoryJobRegistry(clock, Duration.ofMillis(config.reaper().retentionMs()));
        this.jobManager = new JobManager(jobRegistry, clock);
        this.reaper = new JobReaper(jobRegistry, config.reaper());

        // Locking and environments
        this.lock = new DistributedLock(recordStore, clock);
        this.catalog = new EnvironmentCatalog(repository);

        // Pools
        OrchestratorConfig orchestratorConfig = config.orchestrator();
        this.fanOutPool = orchestratorConfig.isUnboundedFanOut()
            ? Executors.newCachedThreadPool(daemonThreads("steward-unit-"))
            : Executors.newFixedThreadPool(orchestratorConfig.unitConcurrency(), daemonThreads("steward-unit-"));
        ExecutorService jobPool = Executors.newFixedThreadPool(orchestratorConfig.jobWorkers(), daemonThreads("steward-job-"));
        this.reaperScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "steward-reaper");
            t.setDaemon(true);
            return t;
        });

        // Orchestrator
        UnitFanOut fanOut = new UnitFanOut(unitExecutor, fanOutPool);
        this.orchestrator = new EnvironmentOrchestrator(lock, jobManager, repository, fanOut, jobPool, orchestratorConfig);

        log.info("Steward context initialized");
    }

    /**
     * 시스템 시계로 컨텍스트 생성.
     */
    public static StewardContext create(
        StewardConfig config,
        RecordStore recordStore,
        ResourceRepository repository,
        UnitExecutor unitExecutor
    ) {
        return create(config, recordStore, repository, unitExecutor, Clock.systemUTC());
    }

    /**
     * 주어진 시계로 컨텍스트 생성 (테스트용).
     */
    public static StewardContext create(
        StewardConfig config,
        RecordStore recordStore,
        ResourceRepository repository,
        UnitExecutor unitExecutor,
        Clock clock
    ) {
        return new StewardContext(config, recordStore, repository, unitExecutor, clock);
    }

    public StewardConfig config() {
        return config;
    }

    public Orchestrator orchestrator() {
        return orchestrator;
    }

    public EnvironmentCatalog catalog() {
        return catalog;
    }

    public DistributedLock lock() {
        return lock;
    }

    public JobManager jobManager() {
        return jobManager;
    }

    public InMemoryJobRegistry jobRegistry() {
        return jobRegistry;
    }

    public JobReaper reaper() {
        return reaper;
    }

    /**
     * 만료 Job 주기적 정리 시작.
     */
    public synchronized void startReaper() {
        if (closed.get()) {
            throw new IllegalStateException("Steward context is closed");
        }
        if (reaperTask != null) {
            log.warn("JobReaper already running");
            return;
        }
        reaperTask = reaper.start(reaperScheduler);
    }

    /**
     * 컨텍스트 종료.
     *
     * <p>순서: 리퍼 중지 → Orchestrator 종료 (실행 중 Job 대기, 시작 못한 Job은 FAILURE,
     * 모든 Job이 끝났으면 보유 락 해제) → 팬아웃 풀 종료 → Job 레지스트리 비움.
     * 여러 번 호출해도 안전합니다.</p>
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Closing steward context...");

        synchronized (this) {
            if (reaperTask != null) {
                reaperTask.cancel(false);
            }
        }
        reaperScheduler.shutdownNow();

        try {
            orchestrator.shutdown();
            stopPool(fanOutPool);
        } catch (InterruptedException e) {
            fanOutPool.shutdownNow();
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing steward context");
        } finally {
            jobRegistry.clear();
        }

        log.info("Steward context closed");
    }

    private static void stopPool(ExecutorService pool) throws InterruptedException {
        pool.shutdown();
        if (!pool.awaitTermination(POOL_SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
            pool.shutdownNow();
            log.warn("Unit pool forcefully stopped");
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return r -> {
            Thread t = new Thread(r, prefix + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}

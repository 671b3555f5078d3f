package com.ryuqq.steward.adapter.runner;

import com.ryuqq.steward.core.spi.JobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * JobReaper 컴포넌트.
 *
 * <p>보존 기간이 지난 종료 Job을 레지스트리에서 제거합니다.
 * 레지스트리는 조회 시점에도 만료 항목을 지우지만, 아무도 조회하지 않는 Ticket의
 * Job이 무한히 쌓이지 않도록 주기적으로 정리합니다.</p>
 *
 * <p><strong>정리 흐름:</strong></p>
 * <pre>
 * 1. Orchestrator가 Job을 종료 → JobManager.terminate(job)
 * 2. 레지스트리가 종료 시각을 기록
 * 3. JobReaper가 주기적 스캔 (예: 1분마다)
 * 4. 종료 후 retention 초과 Job 제거 → 이후 Ticket 조회는 JobNotFoundException
 * </pre>
 *
 * <p><strong>멱등성:</strong> 이미 제거된 Job은 다시 제거되지 않으므로 여러 번 호출해도 안전합니다.</p>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public final class JobReaper {

    private static final Logger log = LoggerFactory.getLogger(JobReaper.class);
    private final JobRegistry registry;
    private final JobReaperConfig config;

    /**
     * 생성자.
     *
     * @param registry Job 레지스트리
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public JobReaper(JobRegistry registry, JobReaperConfig config) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.registry = registry;
        this.config = config;
    }

    /**
     * 만료 Job 스캔 및 제거.
     *
     * <p>예외가 발생해도 스케줄러 스레드를 죽이지 않도록 로깅 후 0을 반환합니다.</p>
     *
     * @return 제거된 Job 수
     */
    public int scan() {
        try {
            int purged = registry.purgeExpired();
            if (purged > 0) {
                log.info("JobReaper purged {} expired job(s), {} remaining", purged, registry.size());
            } else {
                log.debug("JobReaper scan completed: nothing to purge");
            }
            return purged;
        } catch (RuntimeException e) {
            log.error("JobReaper scan failed", e);
            return 0;
        }
    }

    /**
     * 주기적 스캔 시작.
     *
     * @param scheduler 스캔을 실행할 스케줄러
     * @return 스케줄 핸들 (취소용)
     */
    public ScheduledFuture<?> start(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        long interval = config.scanIntervalMs();
        ScheduledFuture<?> future = scheduler.scheduleWithFixedDelay(this::scan, interval, interval, TimeUnit.MILLISECONDS);
        log.info("JobReaper scheduled every {}ms (retention {}ms)", interval, config.retentionMs());
        return future;
    }
}

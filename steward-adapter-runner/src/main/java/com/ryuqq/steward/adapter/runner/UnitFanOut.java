package com.ryuqq.steward.adapter.runner;

import com.ryuqq.steward.core.error.RemoteCommandException;
import com.ryuqq.steward.core.model.UnitId;
import com.ryuqq.steward.core.spi.UnitExecutor;
import com.ryuqq.steward.core.unit.UnitOperation;
import com.ryuqq.steward.core.unit.UnitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * 유닛별 작업을 동시에 실행하고 모두 끝날 때까지 기다리는 구조화된 팬아웃.
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>유닛마다 정확히 한 번 실행 (자동 재시도 없음)</li>
 *   <li>한 유닛의 실패는 다른 유닛에 영향을 주지 않음</li>
 *   <li>{@link #run(List, UnitOperation)}이 반환될 때 모든 유닛 작업이 끝나 있음</li>
 * </ul>
 *
 * <p>동시 실행 수는 주입된 풀의 크기로 제한됩니다. 제한 없는 팬아웃에는 캐시 풀을 사용합니다.
 * 이 풀은 Job 워커 풀과 분리되어야 합니다.</p>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public final class UnitFanOut {

    private static final Logger log = LoggerFactory.getLogger(UnitFanOut.class);
    private final UnitExecutor unitExecutor;
    private final ExecutorService pool;

    /**
     * 생성자.
     *
     * @param unitExecutor 원격 유닛 실행기
     * @param pool 유닛 작업 전용 스레드 풀
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public UnitFanOut(UnitExecutor unitExecutor, ExecutorService pool) {
        if (unitExecutor == null) {
            throw new IllegalArgumentException("unitExecutor cannot be null");
        }
        if (pool == null) {
            throw new IllegalArgumentException("pool cannot be null");
        }
        this.unitExecutor = unitExecutor;
        this.pool = pool;
    }

    /**
     * 모든 유닛에 작업을 팬아웃하고 결과를 집계.
     *
     * @param units 대상 유닛 목록
     * @param operation 실행할 작업
     * <p>대기 중 인터럽트되어도 이미 디스패치된 유닛 작업은 취소하지 않고 끝까지 join합니다.
     * 반환 시 인터럽트 플래그를 복원합니다.</p>
     *
     * @return 유닛별 결과 보고서 (입력 순서 유지)
     */
    public FanOutReport run(List<UnitId> units, UnitOperation operation) {
        if (units == null) {
            throw new IllegalArgumentException("units cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }

        // 1. 유닛마다 작업 하나씩 제출
        List<Future<UnitResult>> futures = new ArrayList<>(units.size());
        for (UnitId unit : units) {
            futures.add(pool.submit(() -> runOne(unit, operation)));
        }

        // 2. 전부 join (인터럽트되어도 계속)
        List<UnitResult> results = new ArrayList<>(units.size());
        boolean interrupted = false;
        int next = 0;
        while (next < futures.size()) {
            try {
                results.add(await(units.get(next), futures.get(next)));
                next++;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            log.warn("Interrupted while joining {} on {} units, all units joined before returning",
                operation, units.size());
            Thread.currentThread().interrupt();
        }

        FanOutReport report = new FanOutReport(results);
        log.info("{} finished on {} units: {} succeeded, {} failed",
            operation, report.total(), report.successCount(), report.failureCount());
        return report;
    }

    private UnitResult runOne(UnitId unit, UnitOperation operation) {
        try {
            unitExecutor.run(unit, operation);
            log.debug("{} succeeded on {}", operation, unit.getValue());
            return UnitResult.success(unit);
        } catch (RemoteCommandException e) {
            log.warn("{} failed on {}: {}", operation, unit.getValue(), e.getMessage());
            return UnitResult.failure(unit, describe(e));
        } catch (RuntimeException e) {
            log.error("Unexpected error during {} on {}", operation, unit.getValue(), e);
            return UnitResult.failure(unit, e.getClass().getName() + ": " + describe(e));
        }
    }

    private UnitResult await(UnitId unit, Future<UnitResult> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Unit task for {} terminated abnormally", unit.getValue(), cause);
            return UnitResult.failure(unit, cause.getClass().getName() + ": " + describe(cause));
        }
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}

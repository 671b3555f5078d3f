package com.ryuqq.steward.adapter.runner;

import com.ryuqq.steward.core.job.JobResult;
import com.ryuqq.steward.core.model.UnitId;
import com.ryuqq.steward.core.unit.UnitResult;

import java.util.List;

/**
 * 한 번의 팬아웃에서 모든 유닛 결과를 집계한 보고서.
 *
 * @param results 유닛별 결과 (유닛 당 정확히 하나, 입력 순서 유지)
 *
 * @author Steward Team
 * @since 1.0.0
 */
public record FanOutReport(List<UnitResult> results) {

    public FanOutReport {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public int total() {
        return results.size();
    }

    public int successCount() {
        return (int) results.stream().filter(UnitResult::succeeded).count();
    }

    public int failureCount() {
        return total() - successCount();
    }

    public List<UnitId> failedUnits() {
        return results.stream()
            .filter(result -> !result.succeeded())
            .map(UnitResult::unit)
            .toList();
    }

    /**
     * Job 결과 페이로드로 변환.
     *
     * @return 카운트와 실패 유닛 목록을 담은 JobResult
     */
    public JobResult toJobResult() {
        return JobResult.ofUnits(successCount(), failedUnits());
    }
}

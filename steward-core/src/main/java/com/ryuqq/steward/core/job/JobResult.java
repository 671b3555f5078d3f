package com.ryuqq.steward.core.job;

import com.ryuqq.steward.core.model.UnitId;

import java.util.List;

/**
 * Job 종료 시 함께 기록되는 구조화된 결과.
 *
 * <p>부분 실패의 경우 성공/실패 카운트와 실패한 유닛 목록을,
 * 실행 전 오류의 경우 오류 코드와 원인을 담습니다.</p>
 *
 * @param successCount 성공한 유닛 수
 * @param failureCount 실패한 유닛 수
 * @param failedUnits 실패한 유닛 목록
 * @param errorCode 오류 코드 (성공 시 null)
 * @param cause 원인 설명 (선택, null 가능)
 *
 * @author Steward Team
 * @since 1.0.0
 */
public record JobResult(
    int successCount,
    int failureCount,
    List<UnitId> failedUnits,
    String errorCode,
    String cause
) {

    /**
     * 유닛 실패 집계 시 사용하는 오류 코드.
     */
    public static final String UNIT_FAILURE = "UNIT-FAILURE";

    /**
     * 예상하지 못한 내부 오류 코드.
     */
    public static final String INTERNAL_ERROR = "INTERNAL-500";

    private static final JobResult EMPTY = new JobResult(0, 0, List.of(), null, null);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 카운트가 음수이거나 failedUnits가 failureCount보다 많은 경우
     */
    public JobResult {
        if (successCount < 0) {
            throw new IllegalArgumentException("successCount cannot be negative");
        }
        if (failureCount < 0) {
            throw new IllegalArgumentException("failureCount cannot be negative");
        }
        failedUnits = failedUnits == null ? List.of() : List.copyOf(failedUnits);
        if (failedUnits.size() > failureCount) {
            throw new IllegalArgumentException("failedUnits cannot exceed failureCount");
        }
    }

    /**
     * 빈 결과.
     *
     * @return 카운트 0, 오류 없음
     */
    public static JobResult empty() {
        return EMPTY;
    }

    /**
     * 유닛 집계 결과 생성.
     *
     * @param successCount 성공 수
     * @param failedUnits 실패한 유닛 목록 (failureCount = size)
     * @return JobResult (실패가 있으면 UNIT-FAILURE 코드)
     */
    public static JobResult ofUnits(int successCount, List<UnitId> failedUnits) {
        List<UnitId> failed = failedUnits == null ? List.of() : failedUnits;
        String code = failed.isEmpty() ? null : UNIT_FAILURE;
        return new JobResult(successCount, failed.size(), failed, code, null);
    }

    /**
     * 오류 결과 생성.
     *
     * @param errorCode 오류 코드
     * @param cause 원인 (null 가능)
     * @return JobResult
     * @throws IllegalArgumentException errorCode가 null이거나 빈 문자열인 경우
     */
    public static JobResult error(String errorCode, String cause) {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        return new JobResult(0, 0, List.of(), errorCode, cause);
    }

    /**
     * 오류 코드가 기록되어 있는지 확인.
     *
     * @return errorCode가 있으면 true
     */
    public boolean hasError() {
        return errorCode != null;
    }
}

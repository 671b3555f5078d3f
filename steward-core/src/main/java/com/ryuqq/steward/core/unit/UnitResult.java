package com.ryuqq.steward.core.unit;

import com.ryuqq.steward.core.model.UnitId;

/**
 * 요청 하나에서 유닛 하나의 실행 결과.
 *
 * <p>유닛당 요청당 정확히 한 번 생성되며, 자동 재시도되지 않습니다.</p>
 *
 * @param unit 유닛 ID
 * @param succeeded 성공 여부
 * @param error 실패 사유 (성공 시 null)
 *
 * @author Steward Team
 * @since 1.0.0
 */
public record UnitResult(UnitId unit, boolean succeeded, String error) {

    public UnitResult {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        if (!succeeded && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("error cannot be null or blank for a failed unit");
        }
        if (succeeded && error != null) {
            throw new IllegalArgumentException("error must be null for a successful unit");
        }
    }

    public static UnitResult success(UnitId unit) {
        return new UnitResult(unit, true, null);
    }

    public static UnitResult failure(UnitId unit, String error) {
        return new UnitResult(unit, false, error);
    }
}

package com.ryuqq.steward.core.error;

import com.ryuqq.steward.core.model.UnitId;

/**
 * 단일 유닛에서 원격 명령이 실패함.
 *
 * <p>항상 유닛 단위로 잡혀서 로깅되고 실패 카운트로 집계됩니다.
 * Ticket 경계를 넘어 전파되지 않습니다.</p>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public class RemoteCommandException extends StewardException {

    public static final String ERROR_CODE = "UNIT-502";

    private final UnitId unitId;

    public RemoteCommandException(UnitId unitId, String message) {
        this(unitId, message, null);
    }

    public RemoteCommandException(UnitId unitId, String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
        this.unitId = unitId;
    }

    public UnitId getUnitId() {
        return unitId;
    }
}

package com.ryuqq.steward.core.error;

/**
 * 코디네이션 계층 예외의 공통 상위 타입.
 *
 * <p>모든 하위 예외는 오류 코드(예: LOCK-409, RESOURCE-404)를 가지며,
 * Job이 FAILURE로 종료될 때 {@code JobResult.errorCode}로 기록됩니다.</p>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public abstract class StewardException extends RuntimeException {

    private final String errorCode;

    protected StewardException(String errorCode, String message) {
        this(errorCode, message, null);
    }

    protected StewardException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드
     */
    public String getErrorCode() {
        return errorCode;
    }
}

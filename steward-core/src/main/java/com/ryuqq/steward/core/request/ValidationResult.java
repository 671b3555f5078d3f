package com.ryuqq.steward.core.request;

import java.util.List;

/**
 * 명시적 검증 결과.
 *
 * @param errors 위반 목록 (비어 있으면 유효)
 *
 * @author Steward Team
 * @since 1.0.0
 */
public record ValidationResult(List<String> errors) {

    private static final ValidationResult VALID = new ValidationResult(List.of());

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("errors cannot be null or empty for an invalid result");
        }
        return new ValidationResult(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * 유효하지 않으면 IllegalArgumentException 발생.
     *
     * @throws IllegalArgumentException 위반이 하나라도 있는 경우
     */
    public void orElseThrow() {
        if (!isValid()) {
            throw new IllegalArgumentException("Invalid request: " + String.join("; ", errors));
        }
    }
}

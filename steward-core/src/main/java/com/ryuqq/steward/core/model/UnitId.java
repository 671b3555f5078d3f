package com.ryuqq.steward.core.model;

/**
 * 리소스에 속한 개별 유닛(노드)의 식별자.
 *
 * <p>보통 노드의 public hostname이 사용됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>공백 문자 불가</li>
 * </ul>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public final class UnitId {

    private final String value;

    private UnitId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("UnitId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("UnitId length cannot exceed 255 characters");
        }
        if (value.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("UnitId cannot contain whitespace");
        }
        this.value = value;
    }

    /**
     * UnitId 생성.
     *
     * @param value 유닛 이름 (예: node-1.example.com)
     * @return UnitId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static UnitId of(String value) {
        return new UnitId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UnitId unitId = (UnitId) o;
        return value.equals(unitId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "UnitId{" + value + '}';
    }
}

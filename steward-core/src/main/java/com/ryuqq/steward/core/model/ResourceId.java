package com.ryuqq.steward.core.model;

/**
 * 오케스트레이션 대상 리소스(Environment)의 식별자.
 *
 * <p>ResourceId는 분산 락의 키이자 ResourceRepository 조회 키로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.)만 허용</li>
 * </ul>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public final class ResourceId {

    private final String value;

    private ResourceId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ResourceId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ResourceId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException("ResourceId contains invalid characters. Only alphanumeric, hyphen, underscore and dot are allowed");
        }
        this.value = value;
    }

    /**
     * ResourceId 생성.
     *
     * @param value 리소스 이름
     * @return ResourceId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ResourceId of(String value) {
        return new ResourceId(value);
    }

    /**
     * ResourceId 값 조회.
     *
     * @return 리소스 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResourceId that = (ResourceId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ResourceId{" + value + '}';
    }
}

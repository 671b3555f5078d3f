package com.ryuqq.steward.core.model;

/**
 * 락 소유자 식별자.
 *
 * <p>설정 관리 서버에 접속하는 클라이언트 이름(프로세스 identity)을 표현합니다.
 * 같은 OwnerId로 들어온 acquire 요청은 재진입으로 간주됩니다.</p>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public final class OwnerId {

    private final String value;

    private OwnerId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OwnerId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("OwnerId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * OwnerId 생성.
     *
     * @param value 소유자 이름
     * @return OwnerId 인스턴스
     * @throws IllegalArgumentException null, blank 또는 255자 초과인 경우
     */
    public static OwnerId of(String value) {
        return new OwnerId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OwnerId ownerId = (OwnerId) o;
        return value.equals(ownerId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "OwnerId{" + value + '}';
    }
}

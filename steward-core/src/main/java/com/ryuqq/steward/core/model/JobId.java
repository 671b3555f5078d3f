package com.ryuqq.steward.core.model;

import java.util.UUID;

/**
 * Job의 전역 고유 식별자 (Ticket id).
 *
 * <p>JobRegistry의 키로 사용되며, 호출자는 Ticket을 통해서만 이 값을 다룹니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public final class JobId {

    private final String value;

    private JobId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("JobId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("JobId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("JobId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * JobId 생성.
     *
     * @param value JobId 값
     * @return JobId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static JobId of(String value) {
        return new JobId(value);
    }

    /**
     * UUID 기반 JobId 생성.
     *
     * @return 새 JobId
     */
    public static JobId generate() {
        return new JobId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobId jobId = (JobId) o;
        return value.equals(jobId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "JobId{" + value + '}';
    }
}

package com.ryuqq.steward.core.resource;

import com.ryuqq.steward.core.model.ResourceId;

import java.time.Instant;
import java.util.Map;

/**
 * 오케스트레이션 대상 리소스 (예: Environment).
 *
 * <p>락의 대상이자 속성이 영속되는 단위입니다. 멤버 유닛 목록은
 * {@code ResourceRepository.listMembers()}를 통해 조회합니다.</p>
 *
 * @param id 리소스 ID
 * @param attributes 기본(default) 레벨 속성 (중첩 Map 허용, 불변 사본으로 보관)
 * @param createdAt 생성 시각
 *
 * @author Steward Team
 * @since 1.0.0
 */
public record Resource(
    ResourceId id,
    Map<String, Object> attributes,
    Instant createdAt
) {

    public Resource {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        attributes = AttributeMerger.immutableCopy(attributes);
    }

    /**
     * 속성 없는 리소스 생성.
     *
     * @param id 리소스 ID
     * @param createdAt 생성 시각
     * @return 새 Resource
     */
    public static Resource of(ResourceId id, Instant createdAt) {
        return new Resource(id, Map.of(), createdAt);
    }

    /**
     * 속성을 병합한 새 인스턴스 생성.
     *
     * @param overlay 병합할 속성
     * @return 병합된 속성을 가진 새 Resource
     */
    public Resource mergeAttributes(Map<String, ?> overlay) {
        return new Resource(id, AttributeMerger.deepMerge(attributes, overlay), createdAt);
    }
}

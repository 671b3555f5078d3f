package com.ryuqq.steward.core.request;

import com.ryuqq.steward.core.model.ResourceId;
import com.ryuqq.steward.core.resource.AttributeMerger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 하나의 오케스트레이션 요청 (불변).
 *
 * <p>attributes는 생성 시점에 깊은 사본으로 고정되므로 제출 이후 호출자가
 * 원본 맵을 변경해도 영향을 받지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * OrchestrationRequest request = OrchestrationRequest.forResource(ResourceId.of("production"))
 *     .withAttributes(Map.of("x", "1"))
 *     .withForce(true);
 * </pre>
 *
 * @param targetResourceId 대상 리소스
 * @param attributes 기존 속성에 병합할 속성 (키 유일)
 * @param force 다른 소유자의 락을 무시할지 여부
 *
 * @author Steward Team
 * @since 1.0.0
 */
public record OrchestrationRequest(
    ResourceId targetResourceId,
    Map<String, Object> attributes,
    boolean force
) {

    public OrchestrationRequest {
        if (targetResourceId == null) {
            throw new IllegalArgumentException("targetResourceId cannot be null");
        }
        attributes = AttributeMerger.immutableCopy(attributes);
    }

    /**
     * 속성 없이, force=false인 요청 생성.
     *
     * @param targetResourceId 대상 리소스
     * @return 새 요청
     */
    public static OrchestrationRequest forResource(ResourceId targetResourceId) {
        return new OrchestrationRequest(targetResourceId, Map.of(), false);
    }

    /**
     * attributes만 변경한 새 인스턴스 생성.
     */
    public OrchestrationRequest withAttributes(Map<String, ?> attributes) {
        return new OrchestrationRequest(targetResourceId, AttributeMerger.immutableCopy(attributes), force);
    }

    /**
     * force만 변경한 새 인스턴스 생성.
     */
    public OrchestrationRequest withForce(boolean force) {
        return new OrchestrationRequest(targetResourceId, attributes, force);
    }

    /**
     * 요청 내용 검증.
     *
     * <p><strong>검증 항목:</strong></p>
     * <ul>
     *   <li>속성 키는 null 또는 빈 문자열 불가 (중첩 Map 포함)</li>
     *   <li>중첩 Map의 키는 문자열이어야 함</li>
     *   <li>속성 값은 null 불가</li>
     * </ul>
     *
     * @return 검증 결과
     */
    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        collectErrors("", attributes, errors);
        return errors.isEmpty() ? ValidationResult.valid() : ValidationResult.invalid(errors);
    }

    private static void collectErrors(String path, Map<?, ?> map, List<String> errors) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            Object key = entry.getKey();
            if (!(key instanceof String name)) {
                errors.add("attribute key at '" + path + "' must be a string: " + key);
                continue;
            }
            String qualified = path.isEmpty() ? name : path + "." + name;
            if (name.isBlank()) {
                errors.add("attribute key cannot be blank at '" + path + "'");
            }
            Object value = entry.getValue();
            if (value == null) {
                errors.add("attribute '" + qualified + "' cannot be null");
            } else if (value instanceof Map<?, ?> nested) {
                collectErrors(qualified, nested, errors);
            }
        }
    }
}

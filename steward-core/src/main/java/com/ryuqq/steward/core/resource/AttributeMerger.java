package com.ryuqq.steward.core.resource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 리소스 속성 병합 유틸리티.
 *
 * <p><strong>병합 규칙:</strong></p>
 * <ul>
 *   <li>키 단위 last-write-wins: overlay 값이 base 값을 덮어씀</li>
 *   <li>양쪽 값이 모두 Map이면 재귀적으로 병합 (deep merge)</li>
 *   <li>base에만 있는 키는 유지</li>
 * </ul>
 *
 * <pre>
 * base    = {"app": {"port": 80, "workers": 4}, "x": "0"}
 * overlay = {"app": {"port": 8080}, "x": "1"}
 * merged  = {"app": {"port": 8080, "workers": 4}, "x": "1"}
 * </pre>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public final class AttributeMerger {

    private AttributeMerger() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 두 속성 맵을 병합한 새 맵 반환 (입력은 변경하지 않음).
     *
     * @param base 기존 속성
     * @param overlay 덮어쓸 속성
     * @return 병합된 불변 맵
     * @throws IllegalArgumentException base 또는 overlay가 null인 경우
     */
    public static Map<String, Object> deepMerge(Map<String, ?> base, Map<String, ?> overlay) {
        if (base == null) {
            throw new IllegalArgumentException("base cannot be null");
        }
        if (overlay == null) {
            throw new IllegalArgumentException("overlay cannot be null");
        }
        Map<String, Object> merged = new LinkedHashMap<>(immutableCopy(base));
        for (Map.Entry<String, ?> entry : overlay.entrySet()) {
            merged.put(entry.getKey(), mergeValue(merged.get(entry.getKey()), entry.getValue()));
        }
        return Collections.unmodifiableMap(merged);
    }

    /**
     * 중첩 Map까지 포함한 불변 사본 생성.
     *
     * @param source 원본 (null이면 빈 맵)
     * @return 불변 사본 (키 순서 유지)
     */
    public static <K> Map<K, Object> immutableCopy(Map<K, ?> source) {
        if (source == null) {
            return Map.of();
        }
        Map<K, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<K, ?> entry : source.entrySet()) {
            copy.put(entry.getKey(), copyValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> nested) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : nested.entrySet()) {
                copy.put(entry.getKey(), copyValue(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        return value;
    }

    private static Object mergeValue(Object current, Object incoming) {
        if (current instanceof Map<?, ?> currentMap && incoming instanceof Map<?, ?> incomingMap) {
            Map<Object, Object> merged = new LinkedHashMap<>(currentMap);
            for (Map.Entry<?, ?> entry : incomingMap.entrySet()) {
                merged.put(entry.getKey(), mergeValue(merged.get(entry.getKey()), entry.getValue()));
            }
            return Collections.unmodifiableMap(merged);
        }
        return copyValue(incoming);
    }
}

package com.ryuqq.steward.core.resource;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AttributeMerger 깊은 병합 테스트.
 *
 * @author Steward Team
 * @since 1.0.0
 */
class AttributeMergerTest {

    @Test
    void deepMerge_DisjointKeys_KeepsBoth() {
        // When
        Map<String, Object> merged = AttributeMerger.deepMerge(Map.of("a", "1"), Map.of("b", "2"));

        // Then
        assertEquals(Map.of("a", "1", "b", "2"), merged);
    }

    @Test
    void deepMerge_ScalarConflict_OverlayWins() {
        // When
        Map<String, Object> merged = AttributeMerger.deepMerge(Map.of("x", "0"), Map.of("x", "1"));

        // Then
        assertEquals("1", merged.get("x"));
    }

    @Test
    void deepMerge_NestedMaps_MergedRecursively() {
        // Given
        Map<String, Object> base = Map.of("app", Map.of("port", 80, "name", "web"));
        Map<String, Object> overlay = Map.of("app", Map.of("port", 8080, "tls", true));

        // When
        Map<String, Object> merged = AttributeMerger.deepMerge(base, overlay);

        // Then
        assertEquals(Map.of("port", 8080, "name", "web", "tls", true), merged.get("app"));
    }

    @Test
    void deepMerge_ScalarReplacedByMap_OverlayWins() {
        // When
        Map<String, Object> merged = AttributeMerger.deepMerge(Map.of("app", "flat"), Map.of("app", Map.of("k", "v")));

        // Then
        assertEquals(Map.of("k", "v"), merged.get("app"));
    }

    @Test
    void deepMerge_ResultIsImmutableAndDetached() {
        // Given
        Map<String, Object> overlay = new HashMap<>();
        overlay.put("x", "1");

        // When
        Map<String, Object> merged = AttributeMerger.deepMerge(Map.of(), overlay);
        overlay.put("x", "2");

        // Then
        assertEquals("1", merged.get("x"));
        assertThrows(UnsupportedOperationException.class, () -> merged.put("y", "3"));
    }

    @Test
    void deepMerge_ThreeLevels_KeepsDeepSiblingsAndNestedMapsImmutable() {
        // Given
        Map<String, Object> base = Map.of("app", Map.of("db", Map.of("host", "a", "pool", 4)));
        Map<String, Object> overlay = Map.of("app", Map.of("db", Map.of("host", "b")));

        // When
        Map<String, Object> merged = AttributeMerger.deepMerge(base, overlay);

        // Then
        Map<?, ?> app = (Map<?, ?>) merged.get("app");
        Map<?, ?> db = (Map<?, ?>) app.get("db");
        assertEquals(Map.of("host", "b", "pool", 4), db);
        assertThrows(UnsupportedOperationException.class, () -> app.clear());
        assertThrows(UnsupportedOperationException.class, () -> db.clear());
    }

    @Test
    void immutableCopy_NestedMutableMap_DetachedFromSource() {
        // Given
        Map<String, Object> nested = new HashMap<>();
        nested.put("port", 80);
        Map<String, Object> source = new HashMap<>();
        source.put("app", nested);

        // When
        Map<String, Object> copy = AttributeMerger.immutableCopy(source);
        nested.put("port", 8080);

        // Then
        assertEquals(Map.of("port", 80), copy.get("app"));
    }

    @Test
    void deepMerge_NullArgument_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> AttributeMerger.deepMerge(null, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> AttributeMerger.deepMerge(Map.of(), null));
    }
}

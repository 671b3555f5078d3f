package com.ryuqq.steward.core.job;

import com.ryuqq.steward.core.model.UnitId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JobResult 테스트.
 *
 * @author Steward Team
 * @since 1.0.0
 */
class JobResultTest {

    @Test
    void ofUnits_NoFailures_HasNoErrorCode() {
        // When
        JobResult result = JobResult.ofUnits(3, List.of());

        // Then
        assertEquals(3, result.successCount());
        assertEquals(0, result.failureCount());
        assertFalse(result.hasError());
    }

    @Test
    void ofUnits_WithFailures_UsesUnitFailureCode() {
        // When
        JobResult result = JobResult.ofUnits(2, List.of(UnitId.of("n2")));

        // Then
        assertEquals(1, result.failureCount());
        assertEquals(JobResult.UNIT_FAILURE, result.errorCode());
        assertTrue(result.hasError());
    }

    @Test
    void constructor_NegativeCount_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new JobResult(-1, 0, List.of(), null, null));
    }

    @Test
    void constructor_MoreFailedUnitsThanFailures_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new JobResult(0, 0, List.of(UnitId.of("n1")), null, null));
    }

    @Test
    void error_BlankCode_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> JobResult.error(" ", "cause"));
    }

    @Test
    void finalStatus_NonTerminalState_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new FinalStatus(null, JobState.RUNNING, "running", 0, 0, List.of(), null));
    }
}

package com.ryuqq.steward.testkit.contract;

import com.ryuqq.steward.core.lock.LockConflictException;
import com.ryuqq.steward.core.model.OwnerId;
import com.ryuqq.steward.core.model.ResourceId;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Distributed Lock.
 *
 * <p>Validates mutual exclusion over a shared record store.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Acquire twice by the same owner → true both times</li>
 *   <li>Second owner blocked until release or force-release</li>
 *   <li>Release by a non-holder → false, record intact</li>
 *   <li>Body skipped on conflict, lock released when the body throws</li>
 *   <li>Concurrent acquire by many owners → exactly one winner</li>
 * </ul>
 *
 * @author Steward Team
 * @since 1.0.0
 */
class DistributedLockContractTest extends AbstractContractTest {

    private static final ResourceId RESOURCE = ResourceId.of("shared-env");

    @Test
    void testLock_SameOwnerTwice_BothSucceed() {
        // Given
        OwnerId a = owner("A");

        // When
        boolean first = lock.acquire(RESOURCE, a);
        boolean second = lock.acquire(RESOURCE, a);

        // Then
        assertTrue(first, "First acquire should succeed");
        assertTrue(second, "Re-acquire by the holder should succeed");
        assertLockHeldBy(RESOURCE, a);
    }

    @Test
    void testLock_OtherOwner_BlockedUntilRelease() {
        // Given
        assertTrue(lock.acquire(RESOURCE, owner("O1")));

        // When & Then
        assertFalse(lock.acquire(RESOURCE, owner("O2")), "O2 must not acquire while O1 holds");
        assertTrue(lock.release(RESOURCE, owner("O1")));
        assertTrue(lock.acquire(RESOURCE, owner("O2")), "O2 should acquire after release");
        assertLockHeldBy(RESOURCE, owner("O2"));
    }

    @Test
    void testLock_OtherOwner_AcquiresAfterForceRelease() {
        // Given
        assertTrue(lock.acquire(RESOURCE, owner("O1")));

        // When
        boolean removed = lock.forceRelease(RESOURCE);

        // Then
        assertTrue(removed);
        assertTrue(lock.acquire(RESOURCE, owner("O2")));
    }

    @Test
    void testLock_ReleaseByNonHolder_ReturnsFalseAndKeepsRecord() {
        // Given: O1 holds R
        clock.advance(Duration.ofSeconds(30));
        assertTrue(lock.acquire(RESOURCE, owner("O1")));

        // When
        boolean released = lock.release(RESOURCE, owner("O2"));

        // Then
        assertFalse(released, "Non-holder release must be rejected");
        assertLockHeldBy(RESOURCE, owner("O1"));
        assertEquals(EPOCH.plusSeconds(30), recordStore.find(RESOURCE).orElseThrow().acquiredAt());
    }

    @Test
    void testRunExclusive_Conflict_BodyNeverRuns() {
        // Given
        assertTrue(lock.acquire(RESOURCE, owner("O1")));
        AtomicBoolean ran = new AtomicBoolean(false);

        // When
        LockConflictException error = assertThrows(LockConflictException.class,
                () -> lock.runExclusive(RESOURCE, owner("O2"), false, () -> {
                    ran.set(true);
                }));

        // Then
        assertFalse(ran.get(), "Body must not run without the lock");
        assertEquals(LockConflictException.ERROR_CODE, error.getErrorCode());
        assertLockHeldBy(RESOURCE, owner("O1"));
    }

    @Test
    void testRunExclusive_BodyThrows_LockReleased() {
        // When
        assertThrows(IllegalStateException.class,
                () -> lock.runExclusive(RESOURCE, owner("O1"), false, () -> {
                    throw new IllegalStateException("boom");
                }));

        // Then
        assertUnlocked(RESOURCE);
    }

    @Test
    void testRunExclusive_Force_TakesOverLock() {
        // Given
        assertTrue(lock.acquire(RESOURCE, owner("O1")));

        // When
        String result = lock.runExclusive(RESOURCE, owner("O2"), true, () -> {
            assertLockHeldBy(RESOURCE, owner("O2"));
            return "done";
        });

        // Then
        assertEquals("done", result);
        assertUnlocked(RESOURCE);
    }

    @Test
    void testLock_ConcurrentAcquire_ExactlyOneWinner() throws Exception {
        // Given
        int contenders = 12;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        try {
            for (int i = 0; i < contenders; i++) {
                OwnerId contender = owner("owner-" + i);
                results.add(pool.submit(() -> {
                    start.await();
                    return lock.acquire(RESOURCE, contender);
                }));
            }

            // When
            start.countDown();
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }

            // Then
            assertEquals(1, winners, "Exactly one contender should hold the lock");
            assertEquals(1, recordStore.list().size());
        } finally {
            pool.shutdownNow();
        }
    }
}

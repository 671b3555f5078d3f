package com.ryuqq.steward.testkit.contract;

import com.ryuqq.steward.adapter.inmemory.job.InMemoryJobRegistry;
import com.ryuqq.steward.adapter.inmemory.store.InMemoryRecordStore;
import com.ryuqq.steward.adapter.inmemory.store.InMemoryResourceRepository;
import com.ryuqq.steward.application.lock.DistributedLock;
import com.ryuqq.steward.core.lock.LockRecord;
import com.ryuqq.steward.core.model.OwnerId;
import com.ryuqq.steward.core.model.ResourceId;
import com.ryuqq.steward.core.model.UnitId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>Provides fresh in-memory SPI implementations wired to a shared {@link MutableClock}
 * for every test, plus helpers for building environments and asserting lock state.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>InMemoryRecordStore: lock record storage</li>
 *   <li>InMemoryResourceRepository: environments and their member units</li>
 *   <li>InMemoryJobRegistry: job tracking with retention</li>
 *   <li>ScriptedUnitExecutor: remote command double</li>
 *   <li>DistributedLock: lock service over the record store</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         ResourceId env = createEnvironment("staging", "web-1", "web-2");
 *         assertTrue(lock.acquire(env, owner("A")));
 *         assertLockHeldBy(env, owner("A"));
 *     }
 * }
 * </pre>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected static final Instant EPOCH = Instant.parse("2024-01-01T00:00:00Z");

    protected MutableClock clock;
    protected InMemoryRecordStore recordStore;
    protected InMemoryResourceRepository repository;
    protected InMemoryJobRegistry jobRegistry;
    protected ScriptedUnitExecutor unitExecutor;
    protected DistributedLock lock;

    /**
     * Sets up test fixtures before each test.
     */
    @BeforeEach
    void setUp() {
        clock = new MutableClock(EPOCH);
        recordStore = new InMemoryRecordStore();
        repository = new InMemoryResourceRepository(clock);
        jobRegistry = new InMemoryJobRegistry(clock);
        unitExecutor = new ScriptedUnitExecutor();
        lock = new DistributedLock(recordStore, clock);
    }

    /**
     * Clears all in-memory state to prevent test interference.
     */
    @AfterEach
    void tearDown() {
        if (recordStore != null) {
            recordStore.clear();
        }
        if (repository != null) {
            repository.clear();
        }
        if (jobRegistry != null) {
            jobRegistry.clear();
        }
        if (unitExecutor != null) {
            unitExecutor.clear();
        }
    }

    /**
     * Creates an environment with the given member units.
     *
     * @param id the environment id
     * @param units hostnames of the member units
     * @return the environment's ResourceId
     */
    protected ResourceId createEnvironment(String id, String... units) {
        ResourceId resource = ResourceId.of(id);
        repository.create(resource);
        for (String unit : units) {
            repository.addMember(resource, UnitId.of(unit));
        }
        return resource;
    }

    protected OwnerId owner(String value) {
        return OwnerId.of(value);
    }

    protected UnitId unit(String value) {
        return UnitId.of(value);
    }

    /**
     * Asserts that the lock record for the resource exists and belongs to the owner.
     *
     * @param resource the locked resource
     * @param expectedOwner the expected holder
     */
    protected void assertLockHeldBy(ResourceId resource, OwnerId expectedOwner) {
        Optional<LockRecord> record = recordStore.find(resource);
        assertTrue(record.isPresent(),
                String.format("Expected %s to be locked by %s but no record exists", resource, expectedOwner));
        assertEquals(expectedOwner, record.get().owner(),
                String.format("Expected %s to be locked by %s but was locked by %s",
                        resource, expectedOwner, record.get().owner()));
    }

    /**
     * Asserts that no lock record exists for the resource.
     *
     * @param resource the resource
     */
    protected void assertUnlocked(ResourceId resource) {
        Optional<LockRecord> record = recordStore.find(resource);
        assertTrue(record.isEmpty(),
                String.format("Expected %s to be unlocked but found %s", resource, record.orElse(null)));
    }

    /**
     * Asserts whether the environment still exists in the repository.
     *
     * @param resource the environment id
     * @param expected true if the environment should exist
     */
    protected void assertEnvironmentExists(ResourceId resource, boolean expected) {
        boolean exists = repository.list().stream().anyMatch(env -> env.id().equals(resource));
        assertEquals(expected, exists,
                String.format("Expected environment %s to %s", resource, expected ? "exist" : "be gone"));
    }
}

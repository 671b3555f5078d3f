package com.ryuqq.steward.core.spi;

import com.ryuqq.steward.core.lock.LockRecord;
import com.ryuqq.steward.core.model.ResourceId;

import java.util.List;
import java.util.Optional;

/**
 * Shared remote record store SPI backing the distributed lock.
 *
 * <p>This store is the only resource shared across independent processes.
 * Every process coordinating the same environments must point at the same store
 * (for example a data bag on the configuration management server).</p>
 *
 * <p><strong>Atomicity Requirement:</strong></p>
 * <ul>
 *   <li>{@link #create(LockRecord)} MUST be an atomic create-if-absent.
 *       Two concurrent callers creating a record for the same resource must never both succeed.</li>
 *   <li>The lock layer adds no compare-and-swap of its own on top of this contract.
 *       A store that cannot provide it cannot guarantee mutual exclusion.</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Blocking I/O is allowed; timeouts are the implementation's responsibility</li>
 * </ul>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public interface RecordStore {

    /**
     * Reads the lock record for a resource.
     *
     * @param resource the resource name
     * @return the current record, or empty if the resource is unlocked
     * @throws IllegalArgumentException if resource is null
     */
    Optional<LockRecord> find(ResourceId resource);

    /**
     * Creates the record if, and only if, none exists for its resource.
     *
     * @param record the record to create
     * @return true if this call created the record, false if one already existed
     * @throws IllegalArgumentException if record is null
     */
    boolean create(LockRecord record);

    /**
     * Deletes the record for a resource.
     *
     * @param resource the resource name
     * @return true if a record was deleted, false if none existed
     * @throws IllegalArgumentException if resource is null
     */
    boolean delete(ResourceId resource);

    /**
     * Lists every lock record currently held.
     *
     * @return all records (may be empty)
     */
    List<LockRecord> list();
}

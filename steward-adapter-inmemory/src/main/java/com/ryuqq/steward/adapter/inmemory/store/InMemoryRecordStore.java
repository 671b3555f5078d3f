package com.ryuqq.steward.adapter.inmemory.store;

import com.ryuqq.steward.core.lock.LockRecord;
import com.ryuqq.steward.core.model.ResourceId;
import com.ryuqq.steward.core.spi.RecordStore;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link RecordStore} SPI for testing and single-process use.
 *
 * <p>Create-if-absent is delegated to {@link ConcurrentHashMap#putIfAbsent(Object, Object)},
 * which is atomic per key, so two racing {@link #create(LockRecord)} calls for the same
 * resource can never both succeed.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Shared only within one JVM; independent processes need a remote store</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * RecordStore store = new InMemoryRecordStore();
 * DistributedLock lock = new DistributedLock(store, Clock.systemUTC());
 * </pre>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public class InMemoryRecordStore implements RecordStore {

    private final ConcurrentHashMap<ResourceId, LockRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<LockRecord> find(ResourceId resource) {
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        return Optional.ofNullable(records.get(resource));
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong> atomic via {@code putIfAbsent}.</p>
     */
    @Override
    public boolean create(LockRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        return records.putIfAbsent(record.resource(), record) == null;
    }

    @Override
    public boolean delete(ResourceId resource) {
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        return records.remove(resource) != null;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Records are ordered by acquisition time.</p>
     */
    @Override
    public List<LockRecord> list() {
        return records.values().stream()
            .sorted(Comparator.comparing(LockRecord::acquiredAt))
            .toList();
    }

    /**
     * Clears all records (for testing purposes).
     */
    public void clear() {
        records.clear();
    }
}

package com.ryuqq.steward.adapter.inmemory.job;

import com.ryuqq.steward.core.error.JobNotFoundException;
import com.ryuqq.steward.core.job.Job;
import com.ryuqq.steward.core.model.JobId;
import com.ryuqq.steward.core.spi.JobRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of {@link JobRegistry} SPI.
 *
 * <p>All reads and writes go through a single {@link ReentrantLock}, so the registry
 * behaves as a single writer even when many job workers report concurrently.</p>
 *
 * <p><strong>Retention:</strong> a terminated Job stays resolvable for the configured
 * retention window measured with the injected {@link Clock}. Expired entries are dropped
 * lazily by {@link #find(JobId)} and eagerly by {@link #purgeExpired()}.</p>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public class InMemoryJobRegistry implements JobRegistry {

    /**
     * Default retention window after termination.
     */
    public static final Duration DEFAULT_RETENTION = Duration.ofMinutes(5);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<JobId, Entry> entries = new LinkedHashMap<>();
    private final Clock clock;
    private final Duration retention;

    public InMemoryJobRegistry(Clock clock) {
        this(clock, DEFAULT_RETENTION);
    }

    public InMemoryJobRegistry(Clock clock, Duration retention) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (retention == null || retention.isNegative()) {
            throw new IllegalArgumentException("retention cannot be null or negative");
        }
        this.clock = clock;
        this.retention = retention;
    }

    @Override
    public JobId register(Job job) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        lock.lock();
        try {
            if (entries.containsKey(job.getId())) {
                throw new IllegalStateException("Job already registered: " + job.getId().getValue());
            }
            entries.put(job.getId(), new Entry(job));
            return job.getId();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Job find(JobId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        lock.lock();
        try {
            Entry entry = entries.get(id);
            if (entry == null) {
                throw new JobNotFoundException(id);
            }
            if (entry.isExpired(clock.instant(), retention)) {
                entries.remove(id);
                throw new JobNotFoundException(id);
            }
            return entry.job;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean remove(JobId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        lock.lock();
        try {
            return entries.remove(id) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean terminate(JobId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        lock.lock();
        try {
            Entry entry = entries.get(id);
            if (entry == null || entry.terminatedAt != null) {
                return false;
            }
            entry.terminatedAt = clock.instant();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Job> active() {
        lock.lock();
        try {
            List<Job> active = new ArrayList<>();
            for (Entry entry : entries.values()) {
                if (entry.terminatedAt == null) {
                    active.add(entry.job);
                }
            }
            return active;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int purgeExpired() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int purged = 0;
            Iterator<Entry> iterator = entries.values().iterator();
            while (iterator.hasNext()) {
                if (iterator.next().isExpired(now, retention)) {
                    iterator.remove();
                    purged++;
                }
            }
            return purged;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int size = 0;
            for (Entry entry : entries.values()) {
                if (!entry.isExpired(now, retention)) {
                    size++;
                }
            }
            return size;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every Job (process shutdown or testing).
     */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public Duration getRetention() {
        return retention;
    }

    private static final class Entry {

        private final Job job;
        private Instant terminatedAt;

        private Entry(Job job) {
            this.job = job;
        }

        private boolean isExpired(Instant now, Duration retention) {
            return terminatedAt != null && !now.isBefore(terminatedAt.plus(retention));
        }
    }
}

package com.ryuqq.steward.adapter.inmemory.store;

import com.ryuqq.steward.core.error.ResourceNotFoundException;
import com.ryuqq.steward.core.model.ResourceId;
import com.ryuqq.steward.core.model.UnitId;
import com.ryuqq.steward.core.resource.Resource;
import com.ryuqq.steward.core.spi.ResourceRepository;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link ResourceRepository} SPI.
 *
 * <p>Stores environments and their member units. Members are registered explicitly with
 * {@link #addMember(ResourceId, UnitId)}; a real repository would discover them by
 * searching the configuration management server.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>resources:</strong> ConcurrentHashMap&lt;ResourceId, Resource&gt; - latest persisted state</li>
 *   <li><strong>members:</strong> ConcurrentHashMap&lt;ResourceId, CopyOnWriteArrayList&lt;UnitId&gt;&gt; - member units in registration order</li>
 * </ul>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public class InMemoryResourceRepository implements ResourceRepository {

    private final ConcurrentHashMap<ResourceId, Resource> resources = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ResourceId, CopyOnWriteArrayList<UnitId>> members = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryResourceRepository() {
        this(Clock.systemUTC());
    }

    public InMemoryResourceRepository(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public Resource find(ResourceId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        Resource resource = resources.get(id);
        if (resource == null) {
            throw new ResourceNotFoundException(id);
        }
        return resource;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Only existing resources are updated; persisting an unknown resource returns false.</p>
     */
    @Override
    public boolean persist(Resource resource) {
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        return resources.computeIfPresent(resource.id(), (id, current) -> resource) != null;
    }

    @Override
    public List<UnitId> listMembers(Resource resource) {
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        CopyOnWriteArrayList<UnitId> units = members.get(resource.id());
        return units == null ? List.of() : List.copyOf(units);
    }

    @Override
    public Resource create(ResourceId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        Resource created = Resource.of(id, clock.instant());
        if (resources.putIfAbsent(id, created) != null) {
            throw new IllegalStateException("Environment already exists: " + id.getValue());
        }
        return created;
    }

    @Override
    public List<Resource> list() {
        return List.copyOf(resources.values());
    }

    @Override
    public boolean delete(ResourceId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        members.remove(id);
        return resources.remove(id) != null;
    }

    /**
     * Registers a member unit of an existing environment.
     *
     * @param id the environment id
     * @param unit the unit to add
     * @throws ResourceNotFoundException if the environment does not exist
     */
    public void addMember(ResourceId id, UnitId unit) {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        find(id);
        members.computeIfAbsent(id, key -> new CopyOnWriteArrayList<>()).addIfAbsent(unit);
    }

    /**
     * Clears all resources and members (for testing purposes).
     */
    public void clear() {
        resources.clear();
        members.clear();
    }
}

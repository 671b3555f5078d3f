package com.ryuqq.steward.core.spi;

import com.ryuqq.steward.core.error.ResourceNotFoundException;
import com.ryuqq.steward.core.model.ResourceId;
import com.ryuqq.steward.core.model.UnitId;
import com.ryuqq.steward.core.resource.Resource;

import java.util.List;

/**
 * Resource repository SPI (environments on the configuration management server).
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Lookup and persistence of resource attributes</li>
 *   <li>Enumeration of the member units of a resource</li>
 *   <li>Creation, listing and deletion of resources</li>
 * </ul>
 *
 * <p>Persistence is not transactional with any later unit operation.</p>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public interface ResourceRepository {

    /**
     * Finds a resource.
     *
     * @param id the resource id
     * @return the resource
     * @throws ResourceNotFoundException if the resource does not exist
     */
    Resource find(ResourceId id);

    /**
     * Persists the resource, replacing its stored attributes.
     *
     * @param resource the resource to save
     * @return true if persisted, false if the store rejected the write
     */
    boolean persist(Resource resource);

    /**
     * Lists the member units of a resource.
     *
     * @param resource the resource
     * @return member unit ids (may be empty)
     */
    List<UnitId> listMembers(Resource resource);

    /**
     * Creates an empty resource.
     *
     * @param id the resource id
     * @return the created resource
     * @throws IllegalStateException if the resource already exists
     */
    Resource create(ResourceId id);

    /**
     * Lists every resource.
     *
     * @return all resources (may be empty)
     */
    List<Resource> list();

    /**
     * Deletes a resource.
     *
     * @param id the resource id
     * @return true if deleted, false if it did not exist
     */
    boolean delete(ResourceId id);
}

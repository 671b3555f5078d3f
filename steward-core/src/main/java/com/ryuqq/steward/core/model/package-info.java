/**
 * Core identifiers used across the coordination layer.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.steward.core.model.ResourceId} - Orchestrated resource (environment) name, also the lock key</li>
 *   <li>{@link com.ryuqq.steward.core.model.OwnerId} - Lock holder identity</li>
 *   <li>{@link com.ryuqq.steward.core.model.UnitId} - Member unit (node) of a resource</li>
 *   <li>{@link com.ryuqq.steward.core.model.JobId} - Job identifier referenced by a Ticket</li>
 * </ul>
 *
 * <p>All value objects are immutable and validate their input in the constructor.</p>
 *
 * @since 1.0.0
 * @author Steward Team
 */
package com.ryuqq.steward.core.model;

/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Interfaces implemented by infrastructure adapters to plug the coordination layer
 * into concrete backends.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.steward.core.spi.RecordStore} - Shared lock record store (atomic create-if-absent)</li>
 *   <li>{@link com.ryuqq.steward.core.spi.ResourceRepository} - Resource lookup, persistence and member enumeration</li>
 *   <li>{@link com.ryuqq.steward.core.spi.UnitExecutor} - Remote per-unit command execution</li>
 *   <li>{@link com.ryuqq.steward.core.spi.JobRegistry} - Process-wide Job store with retention</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., steward-adapter-inmemory) provide concrete implementations.
 * Core does not depend on infrastructure.</p>
 *
 * @since 1.0.0
 * @author Steward Team
 */
package com.ryuqq.steward.core.spi;

/**
 * In-memory store adapter implementation package.
 *
 * <p>This package provides reference implementations of the lock record store and the
 * resource repository SPIs for testing and single-process deployments.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.steward.adapter.inmemory.store.InMemoryRecordStore}:
 *       Thread-safe implementation of {@link com.ryuqq.steward.core.spi.RecordStore}</li>
 *   <li>{@link com.ryuqq.steward.adapter.inmemory.store.InMemoryResourceRepository}:
 *       Thread-safe implementation of {@link com.ryuqq.steward.core.spi.ResourceRepository}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Mutual exclusion only within one JVM</li>
 * </ul>
 *
 * @see com.ryuqq.steward.core.spi.RecordStore
 * @see com.ryuqq.steward.core.spi.ResourceRepository
 * @author Steward Team
 * @since 1.0.0
 */
package com.ryuqq.steward.adapter.inmemory.store;

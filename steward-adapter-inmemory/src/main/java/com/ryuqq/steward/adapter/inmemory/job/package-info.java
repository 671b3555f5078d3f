/**
 * In-memory Job registry adapter.
 *
 * <p>Provides {@link com.ryuqq.steward.adapter.inmemory.job.InMemoryJobRegistry}, the
 * process-wide {@link com.ryuqq.steward.core.spi.JobRegistry} with clock-based retention.</p>
 *
 * @author Steward Team
 * @since 1.0.0
 */
package com.ryuqq.steward.adapter.inmemory.job;

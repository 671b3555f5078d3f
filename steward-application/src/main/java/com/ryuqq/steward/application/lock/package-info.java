/**
 * 분산 락.
 *
 * <p>공유 {@link com.ryuqq.steward.core.spi.RecordStore} 위에서 리소스 단위 상호 배제를 제공합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.steward.application.lock.DistributedLock} - acquire/release/forceRelease 및 runExclusive</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.steward.application.lock;

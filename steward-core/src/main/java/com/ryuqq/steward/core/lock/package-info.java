/**
 * Lock model shared by the distributed lock and its record store.
 *
 * <ul>
 *   <li>{@link com.ryuqq.steward.core.lock.LockRecord} - persisted ownership marker, at most one per resource</li>
 *   <li>{@link com.ryuqq.steward.core.lock.LockConflictException} - raised when another owner holds the lock</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Steward Team
 */
package com.ryuqq.steward.core.lock;

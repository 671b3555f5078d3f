/**
 * Error taxonomy of the coordination layer.
 *
 * <ul>
 *   <li>{@link com.ryuqq.steward.core.error.ResourceNotFoundException} (RESOURCE-404) - target resource absent, aborts before any mutation</li>
 *   <li>{@link com.ryuqq.steward.core.lock.LockConflictException} (LOCK-409) - lock held by another owner, carries the holder</li>
 *   <li>{@link com.ryuqq.steward.core.error.RemoteCommandException} (UNIT-502) - single unit failure, always recovered locally</li>
 *   <li>{@link com.ryuqq.steward.core.error.JobNotFoundException} (JOB-404) - unknown or expired ticket</li>
 * </ul>
 *
 * <p>Except for ticket resolution, none of these cross the Ticket boundary. They are
 * recorded as terminal Job states instead.</p>
 *
 * @since 1.0.0
 * @author Steward Team
 */
package com.ryuqq.steward.core.error;

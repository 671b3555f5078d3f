/**
 * Job tracking model.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.steward.core.job.Job} - mutable, monotonic record of one orchestration request</li>
 *   <li>{@link com.ryuqq.steward.core.job.JobState} / {@link com.ryuqq.steward.core.job.JobStateTransition} - lifecycle states and their rules</li>
 *   <li>{@link com.ryuqq.steward.core.job.Ticket} - caller handle resolving through the JobRegistry</li>
 *   <li>{@link com.ryuqq.steward.core.job.JobSnapshot} / {@link com.ryuqq.steward.core.job.FinalStatus} - immutable views</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * QUEUED → RUNNING
 * QUEUED → FAILURE
 * RUNNING → SUCCESS | FAILURE
 *
 * SUCCESS and FAILURE are absorbing.
 * </pre>
 *
 * @since 1.0.0
 * @author Steward Team
 */
package com.ryuqq.steward.core.job;

/**
 * Job 제출 및 종료 관리.
 *
 * <ul>
 *   <li>{@link com.ryuqq.steward.application.job.JobManager} - Job 생성/등록/종료</li>
 *   <li>{@link com.ryuqq.steward.application.job.JobSubmission} - 제출 결과 (Job + Ticket)</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.steward.application.job;

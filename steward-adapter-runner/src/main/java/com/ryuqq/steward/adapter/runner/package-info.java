/**
 * Runner Adapter Layer - Orchestrator 구현체 및 프로세스 구성.
 *
 * <p>이 패키지는 Orchestrator 인터페이스의 구체적인 구현체와 이를 조립하는 구성 루트를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.steward.adapter.runner.EnvironmentOrchestrator} - configure / bootstrap / destroy 실행</li>
 *   <li>{@link com.ryuqq.steward.adapter.runner.UnitFanOut} - 유닛 작업 동시 실행 및 집계</li>
 *   <li>{@link com.ryuqq.steward.adapter.runner.JobReaper} - 보존 기간이 지난 Job 정리</li>
 *   <li>{@link com.ryuqq.steward.adapter.runner.StewardContext} - 구성 루트 (AutoCloseable)</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (EnvironmentOrchestrator, StewardContext)
 *   ↓ implements
 * application (Orchestrator interface, DistributedLock, JobManager)
 *   ↓ depends on
 * core (Job, Ticket, LockRecord, Resource, SPI)
 * </pre>
 *
 * @author Steward Team
 * @since 1.0.0
 */
package com.ryuqq.steward.adapter.runner;

/**
 * Steward Application Layer - 환경 수명주기 조정 API.
 *
 * <p>클라이언트 요청을 수락하고 Ticket을 반환하는 포트를 정의합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.steward.application.orchestrator.Orchestrator} - 수명주기 작업 조정자</li>
 *   <li>{@link com.ryuqq.steward.application.orchestrator.LifecycleOperation} - configure / bootstrap / destroy</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 * </ul>
 *
 * @author Steward Team
 * @since 1.0.0
 */
package com.ryuqq.steward.application.orchestrator;

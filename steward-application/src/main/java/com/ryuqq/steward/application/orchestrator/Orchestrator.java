package com.ryuqq.steward.application.orchestrator;

import com.ryuqq.steward.core.job.Ticket;
import com.ryuqq.steward.core.request.OrchestrationRequest;

/**
 * 환경 수명주기 작업 조정자.
 *
 * <p>요청을 수락하면 Job을 생성하고 즉시 {@link Ticket}을 반환합니다.
 * 실제 작업은 백그라운드 워커에서 실행되며 Job을 종료 상태로 이끕니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * OrchestrationRequest request = OrchestrationRequest.forResource(ResourceId.of("production"))
 *     .withAttributes(Map.of("app", Map.of("version", "1.4.2")));
 * Ticket ticket = orchestrator.configure(request);
 *
 * FinalStatus status = ticket.await();
 * if (!status.isSuccess()) {
 *     // status.failedUnits(), status.errorCode()
 * }
 * </pre>
 *
 * <p><strong>오류 전달:</strong> 작업 중 발생한 오류는 예외로 전파되지 않고
 * Job의 FAILURE 상태와 오류 코드로 기록됩니다.</p>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public interface Orchestrator {

    /**
     * 수명주기 작업 제출.
     *
     * @param operation 수행할 작업
     * @param request 대상 환경 및 속성
     * @return 호출자용 Ticket (즉시 반환)
     * @throws IllegalArgumentException 인자가 null이거나 요청 속성이 유효하지 않은 경우
     * @throws IllegalStateException Orchestrator가 이미 종료된 경우
     */
    Ticket submit(LifecycleOperation operation, OrchestrationRequest request);

    default Ticket configure(OrchestrationRequest request) {
        return submit(LifecycleOperation.CONFIGURE, request);
    }

    default Ticket bootstrap(OrchestrationRequest request) {
        return submit(LifecycleOperation.BOOTSTRAP, request);
    }

    default Ticket destroy(OrchestrationRequest request) {
        return submit(LifecycleOperation.DESTROY, request);
    }
}

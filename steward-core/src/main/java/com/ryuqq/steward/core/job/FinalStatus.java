package com.ryuqq.steward.core.job;

import com.ryuqq.steward.core.model.JobId;
import com.ryuqq.steward.core.model.UnitId;

import java.util.List;

/**
 * Ticket.await()가 반환하는 Job의 최종 상태.
 *
 * <p>항상 종료 상태(SUCCESS, FAILURE)만 담습니다.</p>
 *
 * @param jobId Job ID
 * @param state 종료 상태
 * @param message 사람이 읽을 수 있는 메시지
 * @param successCount 성공한 유닛 수
 * @param failureCount 실패한 유닛 수
 * @param failedUnits 실패한 유닛 목록
 * @param errorCode 오류 코드 (성공 시 null)
 *
 * @author Steward Team
 * @since 1.0.0
 */
public record FinalStatus(
    JobId jobId,
    JobState state,
    String message,
    int successCount,
    int failureCount,
    List<UnitId> failedUnits,
    String errorCode
) {

    public FinalStatus {
        if (state == null || !state.isTerminal()) {
            throw new IllegalArgumentException("state must be terminal (SUCCESS or FAILURE), but was: " + state);
        }
        failedUnits = failedUnits == null ? List.of() : List.copyOf(failedUnits);
    }

    /**
     * 종료된 스냅샷으로부터 생성.
     *
     * @param snapshot 종료 상태 스냅샷
     * @return FinalStatus
     * @throws IllegalArgumentException 스냅샷이 종료 상태가 아닌 경우
     */
    public static FinalStatus from(JobSnapshot snapshot) {
        JobResult result = snapshot.result();
        return new FinalStatus(
            snapshot.id(),
            snapshot.state(),
            snapshot.statusMessage(),
            result.successCount(),
            result.failureCount(),
            result.failedUnits(),
            result.errorCode()
        );
    }

    public boolean isSuccess() {
        return state == JobState.SUCCESS;
    }
}

package com.ryuqq.steward.core.job;

import com.ryuqq.steward.core.model.JobId;

import java.time.Instant;

/**
 * 특정 시점의 Job 상태 사본 (불변).
 *
 * @param id Job ID
 * @param kind Job 종류
 * @param state 상태
 * @param statusMessage 최근 상태 메시지
 * @param result 결과 페이로드
 * @param createdAt 생성 시각
 * @param updatedAt 마지막 변경 시각
 *
 * @author Steward Team
 * @since 1.0.0
 */
public record JobSnapshot(
    JobId id,
    JobKind kind,
    JobState state,
    String statusMessage,
    JobResult result,
    Instant createdAt,
    Instant updatedAt
) {

    public boolean isTerminal() {
        return state.isTerminal();
    }
}

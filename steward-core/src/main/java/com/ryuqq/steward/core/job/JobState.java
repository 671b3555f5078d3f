package com.ryuqq.steward.core.job;

/**
 * Job의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>QUEUED → RUNNING (실행 시작)</li>
 *   <li>QUEUED → FAILURE (리소스 없음 등 실행 전 실패)</li>
 *   <li>RUNNING → SUCCESS (성공)</li>
 *   <li>RUNNING → FAILURE (실패)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * QUEUED ──────────────┐
 *    │                 │ (락 경합 / 실행 전 오류)
 *    ▼ (실행 시작)      │
 * RUNNING              │
 *    │                 │
 *    ├─► SUCCESS       │
 *    │                 ▼
 *    └─────────────► FAILURE
 *
 * 금지된 전이:
 * - SUCCESS → * ❌
 * - FAILURE → * ❌
 * - QUEUED → SUCCESS ❌
 * </pre>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public enum JobState {

    /**
     * 제출됨 (아직 실행 시작 안 됨).
     */
    QUEUED,

    /**
     * 실행 중.
     */
    RUNNING,

    /**
     * 완료 (성공).
     */
    SUCCESS,

    /**
     * 실패.
     */
    FAILURE;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCESS 또는 FAILURE인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE;
    }
}

package com.ryuqq.steward.core.job;

/**
 * Job 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>QUEUED → RUNNING</li>
 *   <li>QUEUED → FAILURE</li>
 *   <li>RUNNING → SUCCESS</li>
 *   <li>RUNNING → FAILURE</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태(SUCCESS, FAILURE)에서는 어떤 상태로도 전이 불가</p>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public final class JobStateTransition {

    private JobStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(JobState from, JobState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case QUEUED -> to == JobState.RUNNING || to == JobState.FAILURE;
            case RUNNING -> to == JobState.SUCCESS || to == JobState.FAILURE;
            case SUCCESS, FAILURE -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static JobState transition(JobState current, JobState next) {
        validate(current, next);
        return next;
    }
}

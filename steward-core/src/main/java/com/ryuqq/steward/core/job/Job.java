package com.ryuqq.steward.core.job;

import com.ryuqq.steward.core.error.StewardException;
import com.ryuqq.steward.core.model.JobId;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * 비동기 오케스트레이션 요청 하나의 진행 기록.
 *
 * <p>Job은 상태를 단조적으로만 전이하며, 종료 상태는 변경되지 않습니다.
 * 진행 API는 해당 요청을 실행하는 Orchestrator만 호출합니다.</p>
 *
 * <p><strong>진행 API:</strong></p>
 * <ul>
 *   <li>{@link #markRunning(String)}: QUEUED → RUNNING</li>
 *   <li>{@link #setStatus(String)}: 상태 메시지만 갱신 (비종료)</li>
 *   <li>{@link #succeed(String, JobResult)}: RUNNING → SUCCESS</li>
 *   <li>{@link #fail(String, JobResult)}, {@link #fail(Throwable)}: → FAILURE</li>
 * </ul>
 *
 * <p><strong>멱등성:</strong> 이미 종료된 Job에 대한 종료 전이 호출은 예외 없이 무시됩니다.
 * 정리 경로에서 두 번 호출될 수 있기 때문입니다.</p>
 *
 * <p><strong>동시성:</strong> 모든 상태 변경은 Job 자신의 모니터로 직렬화됩니다.</p>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public final class Job {

    private final JobId id;
    private final JobKind kind;
    private final Clock clock;
    private final Instant createdAt;
    private final CompletableFuture<FinalStatus> completion = new CompletableFuture<>();

    private JobState state;
    private String statusMessage;
    private JobResult result;
    private Instant updatedAt;

    /**
     * 생성자.
     *
     * @param id Job ID
     * @param kind Job 종류
     * @param clock 시각 소스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public Job(JobId id, JobKind kind, Clock clock) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.id = id;
        this.kind = kind;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
        this.state = JobState.QUEUED;
        this.statusMessage = "Queued";
        this.result = JobResult.empty();
    }

    /**
     * 새 JobId로 QUEUED 상태의 Job 생성.
     *
     * @param kind Job 종류
     * @param clock 시각 소스
     * @return 새 Job
     */
    public static Job create(JobKind kind, Clock clock) {
        return new Job(JobId.generate(), kind, clock);
    }

    public JobId getId() {
        return id;
    }

    public JobKind getKind() {
        return kind;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized JobState getState() {
        return state;
    }

    public synchronized boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * 실행 시작 보고 (QUEUED → RUNNING).
     *
     * <p>이미 종료된 Job이면 무시합니다.</p>
     *
     * @param message 상태 메시지
     * @throws IllegalStateException RUNNING 상태에서 다시 호출한 경우
     */
    public synchronized void markRunning(String message) {
        if (state.isTerminal()) {
            return;
        }
        state = JobStateTransition.transition(state, JobState.RUNNING);
        touch(message);
    }

    /**
     * 상태 메시지 갱신 (상태는 변경하지 않음).
     *
     * <p>종료된 Job의 메시지는 변경되지 않습니다.</p>
     *
     * @param message 상태 메시지
     */
    public synchronized void setStatus(String message) {
        if (state.isTerminal()) {
            return;
        }
        touch(message);
    }

    /**
     * 성공 보고.
     *
     * @param message 메시지
     * @return 전이가 적용되었으면 true, 이미 종료된 경우 false
     */
    public boolean succeed(String message) {
        return succeed(message, JobResult.empty());
    }

    /**
     * 성공 보고 (결과 페이로드 포함).
     *
     * @param message 메시지
     * @param payload 결과
     * @return 전이가 적용되었으면 true, 이미 종료된 경우 false
     * @throws IllegalStateException QUEUED 상태에서 호출한 경우
     */
    public boolean succeed(String message, JobResult payload) {
        return terminate(JobState.SUCCESS, message, payload);
    }

    /**
     * 실패 보고.
     *
     * @param message 메시지
     * @param payload 결과 (오류 코드, 카운트 등)
     * @return 전이가 적용되었으면 true, 이미 종료된 경우 false
     */
    public boolean fail(String message, JobResult payload) {
        return terminate(JobState.FAILURE, message, payload);
    }

    /**
     * 예외로부터 실패 보고.
     *
     * <p>{@link StewardException}이면 그 오류 코드를, 그 외에는
     * {@link JobResult#INTERNAL_ERROR}를 기록합니다.</p>
     *
     * @param error 실패 원인
     * @return 전이가 적용되었으면 true, 이미 종료된 경우 false
     */
    public boolean fail(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        if (error instanceof StewardException stewardException) {
            return fail(message, JobResult.error(stewardException.getErrorCode(), message));
        }
        return fail(message, JobResult.error(JobResult.INTERNAL_ERROR, error.getClass().getName() + ": " + message));
    }

    /**
     * 현재 상태 사본 조회.
     *
     * @return JobSnapshot
     */
    public synchronized JobSnapshot snapshot() {
        return new JobSnapshot(id, kind, state, statusMessage, result, createdAt, updatedAt);
    }

    /**
     * 종료 시 완료되는 Future (Ticket 전용).
     */
    CompletableFuture<FinalStatus> completion() {
        return completion;
    }

    private boolean terminate(JobState target, String message, JobResult payload) {
        FinalStatus finalStatus;
        synchronized (this) {
            if (state.isTerminal()) {
                return false;
            }
            state = JobStateTransition.transition(state, target);
            result = payload == null ? JobResult.empty() : payload;
            touch(message);
            finalStatus = FinalStatus.from(snapshot());
        }
        completion.complete(finalStatus);
        return true;
    }

    private void touch(String message) {
        if (message != null) {
            statusMessage = message;
        }
        updatedAt = clock.instant();
    }

    @Override
    public String toString() {
        return "Job{id=" + id.getValue() + ", kind=" + kind + ", state=" + getState() + "}";
    }
}

package com.ryuqq.aar.adapter.runner;

import com.ryuqq.aar.application.orchestrator.TaskCallback;
import com.ryuqq.aar.core.engine.AnalysisResult;
import com.ryuqq.aar.core.model.Task;
import com.ryuqq.aar.core.model.TaskResult;
import com.ryuqq.aar.core.statemachine.StateTransition;
import com.ryuqq.aar.core.statemachine.TaskStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Future;

/**
 * Task 실행 기록 (가변, 내부 전용).
 *
 * <p>thread-safe하지 않습니다. 모든 접근은 오케스트레이터의 lock 안에서 이루어지며,
 * 외부에는 {@link #snapshot()}으로 만든 불변 {@link TaskResult}만 노출됩니다.</p>
 *
 * <p>상태 변경은 모두 {@link StateTransition}을 거치므로 종료 상태는 다시 바뀌지 않습니다.</p>
 *
 * @param <D> 데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class TaskExecution<D> {

    private final Task<D> task;
    private final TaskCallback callback;
    private final Instant submittedAt;

    private TaskStatus status = TaskStatus.PENDING;
    private AnalysisResult result;
    private String error;
    private Instant startedAt;
    private Instant endedAt;
    private Future<?> future;

    TaskExecution(Task<D> task, TaskCallback callback, Instant submittedAt) {
        this.task = task;
        this.callback = callback;
        this.submittedAt = submittedAt;
    }

    void markRunning(Instant now) {
        status = StateTransition.transition(status, TaskStatus.RUNNING);
        startedAt = now;
    }

    void complete(AnalysisResult result, Instant now) {
        status = StateTransition.transition(status, TaskStatus.COMPLETED);
        this.result = result;
        endedAt = now;
    }

    void fail(String error, Instant now) {
        status = StateTransition.transition(status, TaskStatus.FAILED);
        this.error = error;
        endedAt = now;
    }

    void cancel(Instant now) {
        status = StateTransition.transition(status, TaskStatus.CANCELLED);
        endedAt = now;
    }

    void attach(Future<?> future) {
        this.future = future;
    }

    Task<D> task() {
        return task;
    }

    TaskCallback callback() {
        return callback;
    }

    TaskStatus status() {
        return status;
    }

    AnalysisResult result() {
        return result;
    }

    Future<?> future() {
        return future;
    }

    /**
     * 실행 시간 (시작과 종료가 모두 기록된 경우).
     *
     * @return 실행 시간, 없으면 null
     */
    Duration executionTime() {
        if (startedAt == null || endedAt == null) {
            return null;
        }
        return Duration.between(startedAt, endedAt);
    }

    TaskResult snapshot() {
        return new TaskResult(
            task.getTaskId(),
            task.getDomain(),
            status,
            task.getPriority(),
            result,
            error,
            submittedAt,
            startedAt,
            endedAt
        );
    }
}

package com.ryuqq.aar.adapter.runner;

import com.ryuqq.aar.core.engine.AnalysisResult;
import com.ryuqq.aar.core.model.AnalysisDomain;
import com.ryuqq.aar.core.model.TaskId;
import com.ryuqq.aar.core.statemachine.TaskStatus;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Task 기록 장부.
 *
 * <p>활성(PENDING, RUNNING) 기록과 종료 기록을 분리 보관하고,
 * 도메인별 최신 완료 결과와 누적 지표를 관리합니다.</p>
 *
 * <p><strong>불변식:</strong> 제출된 Task ID는 항상 active, completed 중 정확히 한 곳에 있습니다
 * ({@link #clearCompleted()}로 삭제되기 전까지).</p>
 *
 * <p>thread-safe하지 않습니다. 오케스트레이터의 lock 안에서만 사용됩니다.</p>
 *
 * @param <D> 데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class TaskLedger<D> {

    private final Map<TaskId, TaskExecution<D>> active = new LinkedHashMap<>();
    private final Map<TaskId, TaskExecution<D>> completed = new LinkedHashMap<>();
    private final Map<AnalysisDomain, AnalysisResult> latestResults = new LinkedHashMap<>();

    private long totalTasks;
    private long successfulTasks;
    private long failedTasks;
    private long cancelledTasks;
    private long timedTasks;
    private Duration totalExecutionTime = Duration.ZERO;

    void add(TaskExecution<D> execution) {
        active.put(execution.task().getTaskId(), execution);
        totalTasks++;
    }

    TaskExecution<D> findActive(TaskId taskId) {
        return active.get(taskId);
    }

    TaskExecution<D> find(TaskId taskId) {
        TaskExecution<D> execution = active.get(taskId);
        return execution != null ? execution : completed.get(taskId);
    }

    /**
     * 종료 상태가 된 기록을 active에서 completed로 이동하고 지표를 갱신.
     *
     * @param execution 종료 상태의 기록
     * @throws IllegalStateException 종료 상태가 아니거나 active에 없는 경우
     */
    void moveToCompleted(TaskExecution<D> execution) {
        TaskStatus status = execution.status();
        if (!status.isTerminal()) {
            throw new IllegalStateException("Task is not terminal: " + status);
        }
        TaskId taskId = execution.task().getTaskId();
        if (active.remove(taskId) == null) {
            throw new IllegalStateException("Task is not active: " + taskId.getValue());
        }
        completed.put(taskId, execution);

        switch (status) {
            case COMPLETED -> {
                successfulTasks++;
                latestResults.put(execution.task().getDomain(), execution.result());
            }
            case FAILED -> failedTasks++;
            case CANCELLED -> cancelledTasks++;
            default -> throw new IllegalStateException("Unexpected terminal status: " + status);
        }

        Duration executionTime = execution.executionTime();
        if (executionTime != null && status != TaskStatus.CANCELLED) {
            timedTasks++;
            totalExecutionTime = totalExecutionTime.plus(executionTime);
        }
    }

    /**
     * 활성 기록 전체 (stop 시 일괄 취소용).
     *
     * @return 복사본
     */
    List<TaskExecution<D>> activeExecutions() {
        return new ArrayList<>(active.values());
    }

    /**
     * 종료 기록과 도메인별 최신 결과 삭제.
     *
     * @return 삭제된 기록 수
     */
    int clearCompleted() {
        int cleared = completed.size();
        completed.clear();
        latestResults.clear();
        return cleared;
    }

    Map<AnalysisDomain, AnalysisResult> latestResults() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(latestResults));
    }

    AnalysisResult latestResult(AnalysisDomain domain) {
        return latestResults.get(domain);
    }

    int activeCount() {
        return active.size();
    }

    int completedCount() {
        return completed.size();
    }

    int countActive(TaskStatus status) {
        int count = 0;
        for (TaskExecution<D> execution : active.values()) {
            if (execution.status() == status) {
                count++;
            }
        }
        return count;
    }

    long totalTasks() {
        return totalTasks;
    }

    long successfulTasks() {
        return successfulTasks;
    }

    long failedTasks() {
        return failedTasks;
    }

    long cancelledTasks() {
        return cancelledTasks;
    }

    /**
     * COMPLETED/FAILED Task의 평균 실행 시간.
     *
     * @return 평균, 기록이 없으면 Duration.ZERO
     */
    Duration averageExecutionTime() {
        if (timedTasks == 0) {
            return Duration.ZERO;
        }
        return totalExecutionTime.dividedBy(timedTasks);
    }
}

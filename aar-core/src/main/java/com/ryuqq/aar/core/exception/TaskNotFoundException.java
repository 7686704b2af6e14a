package com.ryuqq.aar.core.exception;

import com.ryuqq.aar.core.model.TaskId;

/**
 * 알 수 없는 Task ID 조회 오류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TaskNotFoundException extends AnalysisException {

    public static final String ERROR_CODE = "AAR-NOT-FOUND";

    private final TaskId taskId;

    public TaskNotFoundException(TaskId taskId) {
        super(ERROR_CODE, "Task not found: " + (taskId == null ? "null" : taskId.getValue()));
        this.taskId = taskId;
    }

    public TaskId getTaskId() {
        return taskId;
    }
}

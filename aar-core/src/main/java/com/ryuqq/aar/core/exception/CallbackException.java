package com.ryuqq.aar.core.exception;

import com.ryuqq.aar.core.model.TaskId;

/**
 * Task 완료 콜백 오류.
 *
 * <p>완전히 격리되며 Task의 기록된 상태에 영향을 주지 않습니다.
 * CALLBACK_FAILED 이벤트로 별도 발행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CallbackException extends AnalysisException {

    public static final String ERROR_CODE = "AAR-CALLBACK";

    private final TaskId taskId;

    public CallbackException(TaskId taskId, Throwable cause) {
        super(ERROR_CODE, "Callback failed for task " + taskId.getValue() + ": " + cause.getMessage(), cause);
        this.taskId = taskId;
    }

    public TaskId getTaskId() {
        return taskId;
    }
}

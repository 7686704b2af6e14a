package com.ryuqq.aar.core.exception;

import com.ryuqq.aar.core.model.AnalysisDomain;
import com.ryuqq.aar.core.model.TaskId;

/**
 * 엔진 실행 오류 (analyze() 예외 래핑).
 *
 * <p>워커 스레드에서 포착되어 Task 오류로 기록되며, 디스패치 루프로 전파되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class EngineExecutionException extends AnalysisException {

    public static final String ERROR_CODE = "AAR-ENGINE";

    private final TaskId taskId;
    private final AnalysisDomain domain;

    public EngineExecutionException(TaskId taskId, AnalysisDomain domain, Throwable cause) {
        super(ERROR_CODE, describe(cause), cause);
        this.taskId = taskId;
        this.domain = domain;
    }

    public TaskId getTaskId() {
        return taskId;
    }

    public AnalysisDomain getDomain() {
        return domain;
    }

    /**
     * 기록용 오류 메시지 (항상 비어 있지 않음).
     *
     * @param cause 원인 예외
     * @return 원인 메시지, 메시지가 없으면 예외 클래스 이름
     */
    private static String describe(Throwable cause) {
        if (cause == null) {
            return "Engine execution failed";
        }
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getName();
        }
        return message;
    }
}

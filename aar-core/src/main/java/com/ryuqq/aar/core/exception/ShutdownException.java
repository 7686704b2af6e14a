package com.ryuqq.aar.core.exception;

/**
 * 종료된 컴포넌트에 대한 호출 오류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ShutdownException extends AnalysisException {

    public static final String ERROR_CODE = "AAR-SHUTDOWN";

    public ShutdownException(String message) {
        super(ERROR_CODE, message);
    }

    public ShutdownException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}

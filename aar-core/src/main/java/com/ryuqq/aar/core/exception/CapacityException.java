package com.ryuqq.aar.core.exception;

/**
 * 용량 초과 오류 (활성 Task 한도 초과).
 *
 * <p>submitTask 호출 지점에서 동기적으로 발생합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CapacityException extends AnalysisException {

    public static final String ERROR_CODE = "AAR-CAPACITY";

    public CapacityException(String message) {
        super(ERROR_CODE, message);
    }

    public CapacityException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}

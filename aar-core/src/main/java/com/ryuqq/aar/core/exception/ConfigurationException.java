package com.ryuqq.aar.core.exception;

/**
 * 구성 오류 (예: 도메인에 등록된 엔진 없음).
 *
 * <p>submitTask 호출 지점에서 동기적으로 발생하며, Task는 어떤 큐에도 들어가지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConfigurationException extends AnalysisException {

    public static final String ERROR_CODE = "AAR-CONFIG";

    public ConfigurationException(String message) {
        super(ERROR_CODE, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}

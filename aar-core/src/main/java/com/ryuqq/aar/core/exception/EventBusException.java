package com.ryuqq.aar.core.exception;

/**
 * 이벤트 버스 오류.
 *
 * <p>큐가 가득 찬 상태에서 publish 대기 시간이 초과되면 발생합니다 (조용히 버리지 않음).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class EventBusException extends AnalysisException {

    public static final String ERROR_CODE = "AAR-BUS";

    public EventBusException(String message) {
        super(ERROR_CODE, message);
    }

    public EventBusException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}

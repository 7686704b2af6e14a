package com.ryuqq.aar.core.exception;

/**
 * 분석 오케스트레이션 오류의 최상위 예외.
 *
 * <p>모든 하위 예외는 안정적인 오류 코드를 가지며, 로그와 이벤트에서 원인을 구분하는 데 사용됩니다.</p>
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>{@link ConfigurationException} (AAR-CONFIG): 도메인에 엔진 없음 - 동기</li>
 *   <li>{@link CapacityException} (AAR-CAPACITY): 활성 Task 한도 초과 - 동기</li>
 *   <li>{@link TaskNotFoundException} (AAR-NOT-FOUND): 알 수 없는 Task ID - 동기</li>
 *   <li>{@link EngineExecutionException} (AAR-ENGINE): analyze() 예외 래핑 - 비동기 기록</li>
 *   <li>{@link CallbackException} (AAR-CALLBACK): 콜백 예외 래핑 - 격리</li>
 *   <li>{@link ShutdownException} (AAR-SHUTDOWN): 종료 후 호출 - 동기</li>
 *   <li>{@link EventBusException} (AAR-BUS): 이벤트 큐 포화 - 동기</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AnalysisException extends RuntimeException {

    private final String errorCode;

    protected AnalysisException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected AnalysisException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (예: AAR-CONFIG)
     */
    public String getErrorCode() {
        return errorCode;
    }
}

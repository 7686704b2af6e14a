package com.ryuqq.aar.core.event;

import com.ryuqq.aar.core.model.AnalysisDomain;

/**
 * 이벤트 유형 구분자.
 *
 * <p>EventType은 구독자가 관심 있는 상태 변화를 선택하는 키입니다.
 * 오케스트레이터가 발행하는 생명주기 이벤트는 상수로 제공되며,
 * 엔진이 독자적으로 발행하는 도메인 한정 이벤트는 {@link #domainCompleted(AnalysisDomain)}로 만듭니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>EventType.TASK_COMPLETED - Task 완료</li>
 *   <li>EventType.domainCompleted(AnalysisDomain.SAFETY) - SAFETY_ANALYSIS_COMPLETED</li>
 *   <li>EventType.of("REPORT_READY") - 사용자 정의 이벤트</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~80자</li>
 *   <li>패턴: 대문자와 언더스코어만 허용 (예: TASK_SUBMITTED)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EventType {

    public static final EventType TASK_SUBMITTED = new EventType("TASK_SUBMITTED");
    public static final EventType TASK_STARTED = new EventType("TASK_STARTED");
    public static final EventType TASK_COMPLETED = new EventType("TASK_COMPLETED");
    public static final EventType TASK_FAILED = new EventType("TASK_FAILED");
    public static final EventType TASK_CANCELLED = new EventType("TASK_CANCELLED");
    public static final EventType BATCH_SUBMITTED = new EventType("BATCH_SUBMITTED");
    public static final EventType ENGINE_REGISTERED = new EventType("ENGINE_REGISTERED");
    public static final EventType ENGINE_UNREGISTERED = new EventType("ENGINE_UNREGISTERED");
    public static final EventType ORCHESTRATOR_STARTED = new EventType("ORCHESTRATOR_STARTED");
    public static final EventType ORCHESTRATOR_STOPPED = new EventType("ORCHESTRATOR_STOPPED");
    public static final EventType ORCHESTRATOR_ERROR = new EventType("ORCHESTRATOR_ERROR");
    public static final EventType CALLBACK_FAILED = new EventType("CALLBACK_FAILED");
    public static final EventType COMPLETED_TASKS_CLEARED = new EventType("COMPLETED_TASKS_CLEARED");
    public static final EventType DOMAIN_ANALYSIS_FAILED = new EventType("DOMAIN_ANALYSIS_FAILED");
    public static final EventType HANDLER_FAILED = new EventType("HANDLER_FAILED");

    private final String value;

    private EventType(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("EventType cannot be null or blank");
        }
        if (value.length() > 80) {
            throw new IllegalArgumentException("EventType length cannot exceed 80 characters");
        }
        if (!value.matches("^[A-Z_]+$")) {
            throw new IllegalArgumentException("EventType must contain only uppercase letters and underscores");
        }
        this.value = value;
    }

    /**
     * EventType 생성.
     *
     * @param value EventType 값 (예: TASK_SUBMITTED)
     * @return EventType 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static EventType of(String value) {
        return new EventType(value);
    }

    /**
     * 도메인 한정 완료 이벤트 유형 (예: SAFETY_ANALYSIS_COMPLETED).
     *
     * <p>엔진이 직접 발행하는 이벤트이며, 오케스트레이터는 관찰만 합니다.</p>
     *
     * @param domain 분석 도메인
     * @return EventType 인스턴스
     */
    public static EventType domainCompleted(AnalysisDomain domain) {
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        return new EventType(domain.getValue() + "_ANALYSIS_COMPLETED");
    }

    /**
     * 도메인 한정 오류 이벤트 유형 (예: SAFETY_ANALYSIS_FAILED).
     *
     * @param domain 분석 도메인
     * @return EventType 인스턴스
     */
    public static EventType domainFailed(AnalysisDomain domain) {
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        return new EventType(domain.getValue() + "_ANALYSIS_FAILED");
    }

    /**
     * EventType 값 조회.
     *
     * @return EventType 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EventType eventType = (EventType) o;
        return value.equals(eventType.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "EventType{" + value + '}';
    }
}

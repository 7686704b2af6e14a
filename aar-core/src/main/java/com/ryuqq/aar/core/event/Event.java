package com.ryuqq.aar.core.event;

import java.time.Instant;
import java.util.UUID;

/**
 * 상태 변화 알림 (불변 값).
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>eventId:</strong> 이벤트 고유 식별자 (UUID)</li>
 *   <li><strong>type:</strong> 구독 선택 키</li>
 *   <li><strong>payload:</strong> 구조화된 페이로드</li>
 *   <li><strong>source:</strong> 발행 컴포넌트 이름</li>
 *   <li><strong>timestamp:</strong> 발행 시각</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Event event = Event.of(EventType.TASK_SUBMITTED, EventPayload.forTask(taskId, domain), "orchestrator");
 * </pre>
 *
 * @param eventId 이벤트 ID
 * @param type 이벤트 유형
 * @param payload 페이로드
 * @param source 발행자 이름
 * @param timestamp 발행 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Event(
    String eventId,
    EventType type,
    EventPayload payload,
    String source,
    Instant timestamp
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public Event {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("eventId cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (payload == null) {
            payload = EventPayload.empty();
        }
    }

    /**
     * 현재 시각과 새 ID로 Event 생성.
     *
     * @param type 이벤트 유형
     * @param payload 페이로드 (null이면 빈 페이로드)
     * @param source 발행자 이름
     * @return Event 인스턴스
     */
    public static Event of(EventType type, EventPayload payload, String source) {
        return new Event(UUID.randomUUID().toString(), type, payload, source, Instant.now());
    }

    /**
     * 페이로드 없는 Event 생성.
     *
     * @param type 이벤트 유형
     * @param source 발행자 이름
     * @return Event 인스턴스
     */
    public static Event of(EventType type, String source) {
        return of(type, EventPayload.empty(), source);
    }
}

package com.ryuqq.aar.adapter.inmemory.bus;

import com.ryuqq.aar.core.event.EventType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * InMemoryEventBus 통계 스냅샷.
 *
 * @param running 실행 중 여부
 * @param queuedEvents 전체 lane 큐에 대기 중인 이벤트 수
 * @param publishedEvents 큐에 들어간 이벤트 수
 * @param deliveredEvents 모든 핸들러 호출까지 끝난 이벤트 수
 * @param failedPublishes backpressure 타임아웃으로 거부된 publish 수
 * @param droppedEvents stop 이후 또는 종료 시 폐기된 이벤트 수
 * @param handlerCalls 성공한 핸들러 호출 수
 * @param handlerErrors 실패한 핸들러 호출 수
 * @param blockedEvents middleware 또는 filter에 의해 차단된 이벤트 수
 * @param pipelineErrors middleware/filter 실행 오류 수
 * @param historySize 보관 중인 이력 수
 * @param eventsByType 이벤트 타입별 수신 수 (차단된 이벤트 포함)
 * @param subscriptions 구독별 통계
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EventBusStatistics(
    boolean running,
    int queuedEvents,
    long publishedEvents,
    long deliveredEvents,
    long failedPublishes,
    long droppedEvents,
    long handlerCalls,
    long handlerErrors,
    long blockedEvents,
    long pipelineErrors,
    int historySize,
    Map<EventType, Long> eventsByType,
    List<SubscriptionStatistics> subscriptions
) {

    public EventBusStatistics {
        eventsByType = eventsByType == null ? Map.of() : Map.copyOf(eventsByType);
        subscriptions = subscriptions == null ? List.of() : List.copyOf(subscriptions);
    }

    /**
     * 이벤트 타입별 수신 수 조회.
     *
     * @param eventType 이벤트 타입
     * @return 수신 수 (없으면 0)
     */
    public long countOf(EventType eventType) {
        return eventsByType.getOrDefault(eventType, 0L);
    }

    /**
     * 특정 구독 통계 조회.
     *
     * @param eventType 이벤트 타입
     * @param handlerId handlerId
     * @return 구독 통계
     */
    public Optional<SubscriptionStatistics> findSubscription(EventType eventType, String handlerId) {
        return subscriptions.stream()
            .filter(s -> s.eventType().equals(eventType) && s.handlerId().equals(handlerId))
            .findFirst();
    }

    /**
     * 구독별 호출/오류 카운트.
     *
     * @param eventType 이벤트 타입
     * @param handlerId handlerId
     * @param priority 우선순위
     * @param callCount 성공 호출 수
     * @param errorCount 실패 호출 수
     */
    public record SubscriptionStatistics(
        EventType eventType,
        String handlerId,
        int priority,
        long callCount,
        long errorCount
    ) {
    }
}

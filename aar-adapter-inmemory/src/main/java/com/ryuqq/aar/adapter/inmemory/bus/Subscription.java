package com.ryuqq.aar.adapter.inmemory.bus;

import com.ryuqq.aar.core.event.EventHandler;
import com.ryuqq.aar.core.event.EventType;

import java.util.Comparator;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 이벤트 타입별 핸들러 구독.
 *
 * <p>handler와 priority는 같은 handlerId로 재구독될 때 제자리에서 교체되며,
 * 등록 순번(sequence)은 최초 등록 시점 값을 유지합니다.
 * 따라서 교체된 구독도 같은 우선순위 안에서 원래 위치를 지킵니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class Subscription {

    /**
     * 전달 순서: priority 오름차순, 같으면 등록 순번 오름차순.
     */
    static final Comparator<Subscription> DISPATCH_ORDER =
        Comparator.comparingInt(Subscription::priority).thenComparingLong(Subscription::sequence);

    private final EventType eventType;
    private final String handlerId;
    private final long sequence;
    private final AtomicLong callCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();

    private volatile EventHandler handler;
    private volatile int priority;

    Subscription(EventType eventType, String handlerId, long sequence, EventHandler handler, int priority) {
        this.eventType = eventType;
        this.handlerId = handlerId;
        this.sequence = sequence;
        this.handler = handler;
        this.priority = priority;
    }

    void replace(EventHandler handler, int priority) {
        this.handler = handler;
        this.priority = priority;
    }

    void recordCall() {
        callCount.incrementAndGet();
    }

    void recordError() {
        errorCount.incrementAndGet();
    }

    EventType eventType() {
        return eventType;
    }

    String handlerId() {
        return handlerId;
    }

    long sequence() {
        return sequence;
    }

    EventHandler handler() {
        return handler;
    }

    int priority() {
        return priority;
    }

    EventBusStatistics.SubscriptionStatistics toStatistics() {
        return new EventBusStatistics.SubscriptionStatistics(
            eventType, handlerId, priority, callCount.get(), errorCount.get()
        );
    }

    @Override
    public String toString() {
        return "Subscription{type=" + eventType.getValue() + ", handlerId=" + handlerId
            + ", priority=" + priority + '}';
    }
}

package com.ryuqq.aar.adapter.inmemory.bus;

import com.ryuqq.aar.core.event.EventHandler;
import com.ryuqq.aar.core.event.EventType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 구독 레지스트리.
 *
 * <p>이벤트 타입 → handlerId → {@link Subscription}의 명시적 Map으로 관리합니다.
 * 같은 handlerId 재등록은 교체, 해제는 Map 제거로 처리되어 멱등합니다.</p>
 *
 * <p>모든 메서드는 레지스트리 monitor로 동기화되며, 조회는 정렬된 복사본을 반환합니다.
 * 전달 중인 스냅샷은 이후 구독 변경의 영향을 받지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class SubscriptionRegistry {

    private final Map<EventType, Map<String, Subscription>> subscriptions = new HashMap<>();
    private long nextSequence;

    /**
     * 구독 등록 또는 교체.
     *
     * @param eventType 이벤트 타입
     * @param handler 핸들러
     * @param priority 우선순위
     * @param handlerId handlerId (null이면 생성)
     * @return 등록된 handlerId
     */
    synchronized String register(EventType eventType, EventHandler handler, int priority, String handlerId) {
        String id = handlerId != null ? handlerId : "handler-" + UUID.randomUUID();
        Map<String, Subscription> byId = subscriptions.computeIfAbsent(eventType, type -> new LinkedHashMap<>());

        Subscription existing = byId.get(id);
        if (existing != null) {
            existing.replace(handler, priority);
        } else {
            byId.put(id, new Subscription(eventType, id, nextSequence++, handler, priority));
        }
        return id;
    }

    synchronized boolean remove(EventType eventType, String handlerId) {
        Map<String, Subscription> byId = subscriptions.get(eventType);
        if (byId == null || byId.remove(handlerId) == null) {
            return false;
        }
        if (byId.isEmpty()) {
            subscriptions.remove(eventType);
        }
        return true;
    }

    /**
     * 이벤트 타입의 구독을 전달 순서대로 조회.
     *
     * @param eventType 이벤트 타입
     * @return 정렬된 복사본
     */
    synchronized List<Subscription> subscribersOf(EventType eventType) {
        Map<String, Subscription> byId = subscriptions.get(eventType);
        if (byId == null) {
            return List.of();
        }
        List<Subscription> ordered = new ArrayList<>(byId.values());
        ordered.sort(Subscription.DISPATCH_ORDER);
        return ordered;
    }

    synchronized List<Subscription> all() {
        List<Subscription> all = new ArrayList<>();
        for (Map<String, Subscription> byId : subscriptions.values()) {
            all.addAll(byId.values());
        }
        all.sort(Subscription.DISPATCH_ORDER);
        return all;
    }
}

package com.ryuqq.aar.testkit.contract;

import com.ryuqq.aar.core.event.Event;
import com.ryuqq.aar.core.event.EventHandler;
import com.ryuqq.aar.core.event.EventType;
import com.ryuqq.aar.core.exception.EventBusException;
import com.ryuqq.aar.core.spi.EventBus;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Synchronous, recording implementation of EventBus for testing purposes.
 *
 * <p>Every published event is recorded and delivered to subscribers on the
 * publishing thread, so assertions see the exact publish order.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Event recording in publish order</li>
 *   <li>Blocking waits for events published by background threads</li>
 *   <li>Injected publish failure to simulate a saturated bus</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingEventBus implements EventBus {

    private final List<Event> events = new ArrayList<>();
    private final Map<EventType, Map<String, Registered>> subscriptions = new LinkedHashMap<>();

    private boolean running;
    private boolean stopped;
    private long sequence;
    private EventBusException publishFailure;

    @Override
    public synchronized void start() {
        running = !stopped;
    }

    @Override
    public synchronized void stop(Duration timeout) {
        running = false;
        stopped = true;
    }

    @Override
    public synchronized boolean isRunning() {
        return running;
    }

    @Override
    public synchronized String subscribe(EventType eventType, EventHandler handler, int priority, String handlerId) {
        if (eventType == null || handler == null) {
            throw new IllegalArgumentException("eventType and handler cannot be null");
        }
        String id = handlerId != null ? handlerId : UUID.randomUUID().toString();
        Map<String, Registered> byId = subscriptions.computeIfAbsent(eventType, type -> new LinkedHashMap<>());
        Registered existing = byId.get(id);
        long order = existing != null ? existing.sequence : sequence++;
        byId.put(id, new Registered(handler, priority, order));
        return id;
    }

    @Override
    public synchronized boolean unsubscribe(EventType eventType, String handlerId) {
        Map<String, Registered> byId = subscriptions.get(eventType);
        return byId != null && byId.remove(handlerId) != null;
    }

    @Override
    public void publish(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        List<Registered> handlers;
        synchronized (this) {
            if (publishFailure != null) {
                throw publishFailure;
            }
            if (stopped) {
                return;
            }
            events.add(event);
            notifyAll();
            handlers = handlersOf(event.type());
        }
        for (Registered registered : handlers) {
            registered.handler.onEvent(event);
        }
    }

    @Override
    public void publishSync(Event event) {
        publish(event);
    }

    /**
     * Makes every following publish throw the given exception (null to reset).
     *
     * @param failure exception to throw
     */
    public synchronized void failPublishWith(EventBusException failure) {
        this.publishFailure = failure;
    }

    /**
     * Returns all recorded events in publish order.
     *
     * @return copy of recorded events
     */
    public synchronized List<Event> events() {
        return List.copyOf(events);
    }

    public synchronized List<Event> eventsOf(EventType type) {
        return events.stream()
            .filter(event -> event.type().equals(type))
            .collect(Collectors.toUnmodifiableList());
    }

    public synchronized List<EventType> types() {
        return events.stream()
            .map(Event::type)
            .collect(Collectors.toUnmodifiableList());
    }

    public synchronized void clear() {
        events.clear();
    }

    /**
     * Waits until at least {@code count} events of the given type were recorded.
     *
     * @param type event type
     * @param count minimum number of events
     * @param timeout maximum wait
     * @return true if reached before the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public synchronized boolean awaitEvents(EventType type, int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (countOf(type) < count) {
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMs <= 0) {
                return false;
            }
            wait(remainingMs);
        }
        return true;
    }

    private long countOf(EventType type) {
        return events.stream().filter(event -> event.type().equals(type)).count();
    }

    private List<Registered> handlersOf(EventType type) {
        Map<String, Registered> byId = subscriptions.get(type);
        if (byId == null) {
            return List.of();
        }
        List<Registered> ordered = new ArrayList<>(byId.values());
        ordered.sort(Comparator.comparingInt((Registered r) -> r.priority).thenComparingLong(r -> r.sequence));
        return ordered;
    }

    private static final class Registered {
        private final EventHandler handler;
        private final int priority;
        private final long sequence;

        Registered(EventHandler handler, int priority, long sequence) {
            this.handler = handler;
            this.priority = priority;
            this.sequence = sequence;
        }
    }
}

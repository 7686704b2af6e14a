package com.ryuqq.aar.adapter.inmemory.bus;

import com.ryuqq.aar.core.event.Event;
import com.ryuqq.aar.core.event.EventHandler;
import com.ryuqq.aar.core.event.EventPayload;
import com.ryuqq.aar.core.event.EventType;
import com.ryuqq.aar.core.exception.EventBusException;
import com.ryuqq.aar.core.exception.ShutdownException;
import com.ryuqq.aar.core.spi.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of {@link EventBus} SPI.
 *
 * <p>Events are delivered asynchronously by a fixed set of worker lanes. Each lane
 * owns a bounded FIFO queue and a single daemon thread.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Subscriptions:</strong> explicit map (event type → handler id → subscription)</li>
 *   <li><strong>Lanes:</strong> {@code workerThreads} x (ArrayBlockingQueue + Thread)</li>
 *   <li><strong>Routing:</strong> by publishing thread, so one publisher's events stay in order</li>
 *   <li><strong>Pipeline:</strong> middleware chain, then the per-type filter, then fan-out</li>
 *   <li><strong>History:</strong> bounded deque of the most recently delivered events</li>
 * </ul>
 *
 * <p><strong>Failure Isolation:</strong></p>
 * <ul>
 *   <li>A handler exception is caught, logged and counted; remaining handlers still run</li>
 *   <li>The failure is re-published as a {@code HANDLER_FAILED} diagnostic event (non-blocking)</li>
 *   <li>A failing {@code HANDLER_FAILED} handler is only logged</li>
 *   <li>A failing middleware is skipped; a failing filter lets the event through</li>
 * </ul>
 *
 * <p><strong>Backpressure:</strong> {@link #publish(Event)} waits up to
 * {@code publishTimeoutMs} for queue space, then throws {@link EventBusException}.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryEventBus bus = new InMemoryEventBus(new EventBusConfig().withWorkerThreads(2));
 * bus.subscribe(EventType.TASK_FAILED, event -&gt; alerts.raise(event), 0, "alerts");
 * bus.start();
 *
 * bus.publish(Event.of(EventType.TASK_FAILED, payload, "orchestrator"));
 *
 * bus.stop(Duration.ofSeconds(5));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    /**
     * Source name of events generated by the bus itself.
     */
    public static final String SOURCE = "event-bus";

    private enum State { NEW, RUNNING, STOPPED }

    private final EventBusConfig config;
    private final SubscriptionRegistry registry = new SubscriptionRegistry();
    private final List<DispatchLane> lanes;
    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private final Deque<Event> history = new ArrayDeque<>();
    private final List<UnaryOperator<Event>> middleware = new CopyOnWriteArrayList<>();
    private final Map<EventType, Predicate<Event>> filters = new ConcurrentHashMap<>();
    private final Map<EventType, AtomicLong> eventsByType = new ConcurrentHashMap<>();

    private final AtomicLong publishedEvents = new AtomicLong();
    private final AtomicLong deliveredEvents = new AtomicLong();
    private final AtomicLong failedPublishes = new AtomicLong();
    private final AtomicLong droppedEvents = new AtomicLong();
    private final AtomicLong handlerCalls = new AtomicLong();
    private final AtomicLong handlerErrors = new AtomicLong();
    private final AtomicLong blockedEvents = new AtomicLong();
    private final AtomicLong pipelineErrors = new AtomicLong();

    /**
     * Creates a bus with default configuration (4 lanes, capacity 1000, 1s publish timeout).
     */
    public InMemoryEventBus() {
        this(new EventBusConfig());
    }

    /**
     * Creates a bus with custom configuration.
     *
     * @param config bus configuration
     * @throws IllegalArgumentException if config is null
     */
    public InMemoryEventBus(EventBusConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        List<DispatchLane> created = new ArrayList<>(config.workerThreads());
        for (int i = 0; i < config.workerThreads(); i++) {
            created.add(new DispatchLane("aar-event-bus-lane-" + i, config.queueCapacity(), this::deliver));
        }
        this.lanes = List.copyOf(created);
    }

    @Override
    public void start() {
        if (state.compareAndSet(State.NEW, State.RUNNING)) {
            lanes.forEach(DispatchLane::start);
            log.info("Event bus started with {} lanes (queueCapacity={})", lanes.size(), config.queueCapacity());
            return;
        }
        if (state.get() == State.STOPPED) {
            throw new ShutdownException("Event bus has been stopped and cannot be restarted");
        }
    }

    @Override
    public void stop(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative");
        }
        State previous = state.getAndSet(State.STOPPED);
        if (previous == State.STOPPED) {
            return;
        }

        long discarded = 0;
        if (previous == State.NEW) {
            for (DispatchLane lane : lanes) {
                discarded += lane.discardQueued();
            }
        } else {
            discarded = drainLanes(timeout);
        }

        if (discarded > 0) {
            droppedEvents.addAndGet(discarded);
            log.warn("Event bus discarded {} queued events on stop", discarded);
        }
        log.info("Event bus stopped (published={}, delivered={}, dropped={})",
            publishedEvents.get(), deliveredEvents.get(), droppedEvents.get());
    }

    @Override
    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    @Override
    public String subscribe(EventType eventType, EventHandler handler, int priority, String handlerId) {
        if (eventType == null) {
            throw new IllegalArgumentException("eventType cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (handlerId != null && handlerId.isBlank()) {
            throw new IllegalArgumentException("handlerId cannot be blank");
        }
        String id = registry.register(eventType, handler, priority, handlerId);
        log.debug("Subscribed handler {} to {} with priority {}", id, eventType.getValue(), priority);
        return id;
    }

    @Override
    public boolean unsubscribe(EventType eventType, String handlerId) {
        if (eventType == null || handlerId == null) {
            return false;
        }
        boolean removed = registry.remove(eventType, handlerId);
        if (removed) {
            log.debug("Unsubscribed handler {} from {}", handlerId, eventType.getValue());
        }
        return removed;
    }

    @Override
    public void publish(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (state.get() == State.STOPPED) {
            droppedEvents.incrementAndGet();
            log.warn("Event bus is stopped, dropping event {} ({})", event.type().getValue(), event.eventId());
            return;
        }

        DispatchLane lane = laneForCurrentThread();
        boolean accepted;
        try {
            accepted = lane.offer(event, config.publishTimeoutMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failedPublishes.incrementAndGet();
            throw new EventBusException("Interrupted while publishing event " + event.type().getValue(), e);
        }
        if (!accepted) {
            failedPublishes.incrementAndGet();
            throw new EventBusException(String.format(
                "Event queue full: %s was not accepted within %dms", event.type().getValue(), config.publishTimeoutMs()));
        }
        if (state.get() == State.STOPPED && lane.remove(event)) {
            // stop() ran between the state check and the offer; the lane may already be gone
            droppedEvents.incrementAndGet();
            log.warn("Event bus stopped while publishing, dropping event {} ({})", event.type().getValue(), event.eventId());
            return;
        }
        publishedEvents.incrementAndGet();
    }

    /**
     * {@inheritDoc}
     *
     * <p>Works in every bus state; it needs no lane.</p>
     */
    @Override
    public void publishSync(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        deliver(event);
    }

    /**
     * Returns the most recent delivered events, oldest first.
     *
     * @param count maximum number of events
     * @return list of at most {@code count} events
     * @throws IllegalArgumentException if count is negative
     */
    public List<Event> getRecentEvents(int count) {
        return recentEvents(null, count);
    }

    /**
     * Returns the most recent delivered events of one type, oldest first.
     *
     * @param eventType event type filter
     * @param count maximum number of events
     * @return list of at most {@code count} events
     * @throws IllegalArgumentException if eventType is null or count is negative
     */
    public List<Event> getRecentEvents(EventType eventType, int count) {
        if (eventType == null) {
            throw new IllegalArgumentException("eventType cannot be null");
        }
        return recentEvents(eventType, count);
    }

    /**
     * Appends a middleware to the chain applied to every event before fan-out.
     *
     * <p>Middleware runs in registration order. Returning the same or another event passes it
     * to the next step; returning {@code null} blocks the event. A middleware that throws is
     * logged and skipped, and the event continues unchanged.</p>
     *
     * @param middlewareFunction middleware to append
     * @throws IllegalArgumentException if middlewareFunction is null
     */
    public void addMiddleware(UnaryOperator<Event> middlewareFunction) {
        if (middlewareFunction == null) {
            throw new IllegalArgumentException("middlewareFunction cannot be null");
        }
        middleware.add(middlewareFunction);
    }

    /**
     * Sets the filter for one event type, replacing any previous one.
     *
     * <p>Events of that type are delivered only when the filter returns {@code true}.
     * A filter that throws is logged and the event is delivered.</p>
     *
     * @param eventType event type the filter applies to
     * @param filter predicate deciding delivery
     * @throws IllegalArgumentException if eventType or filter is null
     */
    public void addFilter(EventType eventType, Predicate<Event> filter) {
        if (eventType == null) {
            throw new IllegalArgumentException("eventType cannot be null");
        }
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        filters.put(eventType, filter);
    }

    /**
     * Removes the filter of one event type.
     *
     * @param eventType event type
     * @return true if a filter was removed
     */
    public boolean removeFilter(EventType eventType) {
        return eventType != null && filters.remove(eventType) != null;
    }

    public void clearHistory() {
        synchronized (history) {
            history.clear();
        }
    }

    /**
     * Returns a statistics snapshot.
     *
     * @return statistics
     */
    public EventBusStatistics getStatistics() {
        int queued = 0;
        for (DispatchLane lane : lanes) {
            queued += lane.size();
        }
        int historySize;
        synchronized (history) {
            historySize = history.size();
        }
        Map<EventType, Long> byType = new HashMap<>();
        eventsByType.forEach((type, counter) -> byType.put(type, counter.get()));
        List<EventBusStatistics.SubscriptionStatistics> subscriptions = new ArrayList<>();
        for (Subscription subscription : registry.all()) {
            subscriptions.add(subscription.toStatistics());
        }
        return new EventBusStatistics(
            isRunning(),
            queued,
            publishedEvents.get(),
            deliveredEvents.get(),
            failedPublishes.get(),
            droppedEvents.get(),
            handlerCalls.get(),
            handlerErrors.get(),
            blockedEvents.get(),
            pipelineErrors.get(),
            historySize,
            byType,
            subscriptions
        );
    }

    /**
     * Runs the pipeline for one event, then delivers it to every subscriber of its type
     * in dispatch order.
     *
     * @param received event taken from a lane or passed to publishSync
     */
    private void deliver(Event received) {
        eventsByType.computeIfAbsent(received.type(), type -> new AtomicLong()).incrementAndGet();
        Event event = applyMiddleware(received);
        if (event == null || !passesFilter(event)) {
            blockedEvents.incrementAndGet();
            log.debug("Event {} ({}) blocked before delivery", received.type().getValue(), received.eventId());
            return;
        }
        recordHistory(event);
        for (Subscription subscription : registry.subscribersOf(event.type())) {
            invoke(subscription, event);
        }
        deliveredEvents.incrementAndGet();
    }

    private Event applyMiddleware(Event received) {
        Event current = received;
        for (UnaryOperator<Event> step : middleware) {
            Event next;
            try {
                next = step.apply(current);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                pipelineErrors.incrementAndGet();
                log.error("Middleware failed for event {} ({}), skipping it",
                    current.type().getValue(), current.eventId(), e);
                continue;
            }
            if (next == null) {
                return null;
            }
            current = next;
        }
        return current;
    }

    private boolean passesFilter(Event event) {
        Predicate<Event> filter = filters.get(event.type());
        if (filter == null) {
            return true;
        }
        try {
            return filter.test(event);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            pipelineErrors.incrementAndGet();
            log.error("Filter failed for event {} ({}), delivering it",
                event.type().getValue(), event.eventId(), e);
            return true;
        }
    }

    private void invoke(Subscription subscription, Event event) {
        try {
            subscription.handler().onEvent(event);
            subscription.recordCall();
            handlerCalls.incrementAndGet();
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            subscription.recordError();
            handlerErrors.incrementAndGet();
            if (EventType.HANDLER_FAILED.equals(event.type())) {
                log.error("Diagnostic handler {} failed for event {}", subscription.handlerId(), event.eventId(), e);
                return;
            }
            log.error("Handler {} failed for event {} ({})",
                subscription.handlerId(), event.type().getValue(), event.eventId(), e);
            publishHandlerFailure(subscription, event, e);
        }
    }

    private void publishHandlerFailure(Subscription subscription, Event failed, Throwable error) {
        if (state.get() == State.STOPPED) {
            return;
        }
        String message = error.getMessage() == null || error.getMessage().isBlank()
            ? error.getClass().getName()
            : error.getMessage();
        EventPayload payload = new EventPayload(
            failed.payload().taskId(),
            failed.payload().domain(),
            null,
            message,
            Map.of(
                "handlerId", subscription.handlerId(),
                "failedEventType", failed.type().getValue(),
                "failedEventId", failed.eventId()
            )
        );
        Event diagnostic = Event.of(EventType.HANDLER_FAILED, payload, SOURCE);
        if (laneForCurrentThread().offerNow(diagnostic)) {
            publishedEvents.incrementAndGet();
        } else {
            droppedEvents.incrementAndGet();
            log.warn("Lane full, dropping HANDLER_FAILED diagnostic for handler {}", subscription.handlerId());
        }
    }

    private long drainLanes(Duration timeout) {
        lanes.forEach(DispatchLane::requestDrain);
        long deadline = System.nanoTime() + timeout.toNanos();
        long discarded = 0;
        for (DispatchLane lane : lanes) {
            long remainingMs = Math.max(0, (deadline - System.nanoTime()) / 1_000_000L);
            boolean finished;
            try {
                finished = lane.awaitTermination(remainingMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for event bus lanes to drain");
                finished = false;
            }
            if (!finished) {
                discarded += lane.abandon();
            }
        }
        return discarded;
    }

    private DispatchLane laneForCurrentThread() {
        return lanes.get(Math.floorMod(Thread.currentThread().getId(), lanes.size()));
    }

    private void recordHistory(Event event) {
        if (config.historySize() == 0) {
            return;
        }
        synchronized (history) {
            history.addLast(event);
            while (history.size() > config.historySize()) {
                history.removeFirst();
            }
        }
    }

    private List<Event> recentEvents(EventType eventType, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count cannot be negative (current: " + count + ")");
        }
        LinkedList<Event> recent = new LinkedList<>();
        synchronized (history) {
            Iterator<Event> newestFirst = history.descendingIterator();
            while (newestFirst.hasNext() && recent.size() < count) {
                Event event = newestFirst.next();
                if (eventType == null || eventType.equals(event.type())) {
                    recent.addFirst(event);
                }
            }
        }
        return List.copyOf(recent);
    }
}

package com.ryuqq.aar.core.spi;

import com.ryuqq.aar.core.event.Event;
import com.ryuqq.aar.core.event.EventHandler;
import com.ryuqq.aar.core.event.EventType;

import java.time.Duration;

/**
 * Event Bus SPI for decoupled state-change notification.
 *
 * <p>This interface lets producers (the orchestrator, analysis engines) publish
 * notifications without knowing who consumes them (reporting, UI collaborators).</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Registering handlers per event type with an explicit dispatch priority</li>
 *   <li>Asynchronous delivery: {@code publish} never waits for handlers</li>
 *   <li>Isolating handler failures from other handlers and from the bus itself</li>
 *   <li>Bounded, idempotent shutdown</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Ordering: Handlers of one event are invoked in ascending priority order</li>
 *   <li>Per-publisher FIFO: Events published by one thread reach each handler in publish order</li>
 *   <li>Idempotent: subscribe with a known handler id replaces, never duplicates</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * bus.start();
 *
 * bus.subscribe(EventType.TASK_COMPLETED, event -&gt; reportService.refresh(event), 1, "report-refresh");
 * bus.subscribe(EventType.TASK_COMPLETED, event -&gt; statusBar.update(event), 2, "status-bar");
 *
 * bus.publish(Event.of(EventType.TASK_COMPLETED, payload, "orchestrator"));
 *
 * bus.stop(Duration.ofSeconds(5));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EventBus {

    /**
     * Starts event processing.
     *
     * <p>Idempotent while already running.</p>
     *
     * @throws com.ryuqq.aar.core.exception.ShutdownException if the bus was already stopped
     */
    void start();

    /**
     * Stops event processing within the given timeout.
     *
     * <p>Queued events are drained until the deadline; whatever is left is discarded.
     * Calling stop more than once has no further effect.</p>
     *
     * @param timeout maximum time to wait for workers
     * @throws IllegalArgumentException if timeout is null or negative
     */
    void stop(Duration timeout);

    /**
     * Whether the bus is currently delivering events.
     *
     * @return true between start and stop
     */
    boolean isRunning();

    /**
     * Registers a handler for an event type.
     *
     * <p><strong>Idempotent Replacement:</strong> if {@code handlerId} is already registered
     * for {@code eventType}, the existing subscription's handler and priority are replaced
     * in place instead of adding a second subscription.</p>
     *
     * @param eventType the event type to listen to
     * @param handler the handler to invoke
     * @param priority dispatch order (lower runs first)
     * @param handlerId stable handler id, or null to have one generated
     * @return the handler id of the subscription
     * @throws IllegalArgumentException if eventType or handler is null
     */
    String subscribe(EventType eventType, EventHandler handler, int priority, String handlerId);

    /**
     * Registers a handler with a generated handler id.
     *
     * @param eventType the event type to listen to
     * @param handler the handler to invoke
     * @param priority dispatch order (lower runs first)
     * @return the generated handler id
     */
    default String subscribe(EventType eventType, EventHandler handler, int priority) {
        return subscribe(eventType, handler, priority, null);
    }

    /**
     * Removes a subscription.
     *
     * @param eventType the event type
     * @param handlerId the handler id returned by subscribe
     * @return true if a subscription was removed, false if it was absent
     */
    boolean unsubscribe(EventType eventType, String handlerId);

    /**
     * Publishes an event for asynchronous delivery.
     *
     * <p>This method returns as soon as the event is queued. It may block briefly
     * when the queue is full (backpressure).</p>
     *
     * <p><strong>After stop:</strong> the event is dropped and logged; the call never blocks.</p>
     *
     * @param event the event to publish
     * @throws IllegalArgumentException if event is null
     * @throws com.ryuqq.aar.core.exception.EventBusException if queue space did not free up in time
     */
    void publish(Event event);

    /**
     * Delivers an event on the caller's thread and returns after every handler ran.
     *
     * @param event the event to deliver
     * @throws IllegalArgumentException if event is null
     */
    void publishSync(Event event);
}

package com.ryuqq.aar.testkit.contract;

import com.ryuqq.aar.core.event.Event;
import com.ryuqq.aar.core.event.EventType;
import com.ryuqq.aar.core.exception.EventBusException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RecordingEventBus tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RecordingEventBusTest {

    private RecordingEventBus bus;

    @BeforeEach
    void setUp() {
        bus = new RecordingEventBus();
        bus.start();
    }

    @Test
    void testPublish_RecordsEventsInOrder() {
        // Given
        Event submitted = Event.of(EventType.TASK_SUBMITTED, "test");
        Event started = Event.of(EventType.TASK_STARTED, "test");

        // When
        bus.publish(submitted);
        bus.publish(started);

        // Then
        assertEquals(List.of(submitted, started), bus.events());
        assertEquals(List.of(EventType.TASK_SUBMITTED, EventType.TASK_STARTED), bus.types());
        assertEquals(List.of(started), bus.eventsOf(EventType.TASK_STARTED));
    }

    @Test
    void testSubscribe_HandlersCalledInPriorityOrder() {
        // Given
        List<String> calls = new ArrayList<>();
        bus.subscribe(EventType.TASK_COMPLETED, event -> calls.add("second"), 2);
        bus.subscribe(EventType.TASK_COMPLETED, event -> calls.add("first"), 1);
        bus.subscribe(EventType.TASK_COMPLETED, event -> calls.add("third"), 2);

        // When
        bus.publish(Event.of(EventType.TASK_COMPLETED, "test"));

        // Then
        assertEquals(List.of("first", "second", "third"), calls);
    }

    @Test
    void testUnsubscribe_HandlerNoLongerCalled() {
        // Given
        List<Event> received = new ArrayList<>();
        String handlerId = bus.subscribe(EventType.TASK_FAILED, received::add, 1, "audit");

        // When
        boolean removed = bus.unsubscribe(EventType.TASK_FAILED, handlerId);
        bus.publish(Event.of(EventType.TASK_FAILED, "test"));

        // Then
        assertTrue(removed);
        assertTrue(received.isEmpty());
        assertFalse(bus.unsubscribe(EventType.TASK_FAILED, handlerId));
    }

    @Test
    void testFailPublishWith_PublishThrowsUntilReset() {
        // Given
        bus.failPublishWith(new EventBusException("saturated"));

        // When & Then
        assertThrows(EventBusException.class, () -> bus.publish(Event.of(EventType.TASK_SUBMITTED, "test")));
        assertTrue(bus.events().isEmpty());

        bus.failPublishWith(null);
        bus.publish(Event.of(EventType.TASK_SUBMITTED, "test"));
        assertEquals(1, bus.events().size());
    }

    @Test
    void testStop_LaterPublishIgnored() {
        // Given
        bus.stop(Duration.ZERO);

        // When
        bus.publish(Event.of(EventType.TASK_SUBMITTED, "test"));

        // Then
        assertFalse(bus.isRunning());
        assertTrue(bus.events().isEmpty());
    }

    @Test
    void testAwaitEvents_PublishedFromOtherThread_ReturnsTrue() throws InterruptedException {
        // Given
        Thread publisher = new Thread(() -> bus.publish(Event.of(EventType.TASK_COMPLETED, "test")));

        // When
        publisher.start();
        boolean reached = bus.awaitEvents(EventType.TASK_COMPLETED, 1, Duration.ofSeconds(2));
        publisher.join();

        // Then
        assertTrue(reached);
        assertFalse(bus.awaitEvents(EventType.TASK_FAILED, 1, Duration.ofMillis(20)));
    }
}

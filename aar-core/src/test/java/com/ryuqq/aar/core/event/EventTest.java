package com.ryuqq.aar.core.event;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Event 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class EventTest {

    @Test
    void of_GeneratesIdAndTimestamp() {
        // When
        Event first = Event.of(EventType.TASK_SUBMITTED, "orchestrator");
        Event second = Event.of(EventType.TASK_SUBMITTED, "orchestrator");

        // Then
        assertNotNull(first.eventId());
        assertNotEquals(first.eventId(), second.eventId());
        assertNotNull(first.timestamp());
        assertEquals(EventPayload.empty(), first.payload());
    }

    @Test
    void constructor_NullPayload_UsesEmpty() {
        // When
        Event event = new Event("e-1", EventType.TASK_FAILED, null, "orchestrator", Instant.now());

        // Then
        assertEquals(EventPayload.empty(), event.payload());
    }

    @Test
    void constructor_BlankSource_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> Event.of(EventType.TASK_FAILED, EventPayload.empty(), " "));
    }

    @Test
    void constructor_NullType_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> Event.of(null, EventPayload.empty(), "orchestrator"));
    }
}

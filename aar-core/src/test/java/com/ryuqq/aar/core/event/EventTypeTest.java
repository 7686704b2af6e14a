package com.ryuqq.aar.core.event;

import com.ryuqq.aar.core.model.AnalysisDomain;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EventType 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class EventTypeTest {

    @Test
    void of_KnownName_EqualsConstant() {
        // When & Then
        assertEquals(EventType.TASK_COMPLETED, EventType.of("TASK_COMPLETED"));
    }

    @Test
    void domainCompleted_Safety_ReturnsDomainSpecificType() {
        // When
        EventType type = EventType.domainCompleted(AnalysisDomain.SAFETY);

        // Then
        assertEquals("SAFETY_ANALYSIS_COMPLETED", type.getValue());
    }

    @Test
    void domainFailed_Network_ReturnsDomainSpecificType() {
        // When & Then
        assertEquals("NETWORK_ANALYSIS_FAILED", EventType.domainFailed(AnalysisDomain.NETWORK).getValue());
    }

    @Test
    void of_InvalidName_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> EventType.of("task.completed"));
        assertThrows(IllegalArgumentException.class, () -> EventType.of(" "));
        assertThrows(IllegalArgumentException.class, () -> EventType.of("A".repeat(81)));
    }

    @Test
    void domainCompleted_NullDomain_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> EventType.domainCompleted(null));
    }
}

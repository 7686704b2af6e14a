package com.ryuqq.aar.core.engine;

import com.ryuqq.aar.core.model.AnalysisDomain;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AnalysisResult / Alert 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class AnalysisResultTest {

    @Test
    void of_MetricsOnly_HasFullConfidence() {
        // When
        AnalysisResult result = AnalysisResult.of(AnalysisDomain.SAFETY, Map.of("incidents", 0));

        // Then
        assertEquals(1.0, result.confidenceScore());
        assertTrue(result.alerts().isEmpty());
        assertTrue(result.recommendations().isEmpty());
        assertEquals(0, result.metrics().get("incidents"));
    }

    @Test
    void countAlertsAtLeast_MixedLevels_CountsHigherOrEqual() {
        // Given
        List<Alert> alerts = List.of(
            Alert.of(AlertLevel.LOW, "minor", AnalysisDomain.SAFETY),
            Alert.of(AlertLevel.HIGH, "gas leak", AnalysisDomain.SAFETY),
            Alert.of(AlertLevel.CRITICAL, "fire", AnalysisDomain.SAFETY)
        );
        AnalysisResult result = new AnalysisResult(AnalysisDomain.SAFETY, Map.of(), alerts,
            List.of("evacuate"), 0.8, Instant.now());

        // When & Then
        assertEquals(2, result.countAlertsAtLeast(AlertLevel.HIGH));
        assertEquals(3, result.countAlertsAtLeast(AlertLevel.LOW));
    }

    @Test
    void constructor_ConfidenceOutOfRange_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> new AnalysisResult(AnalysisDomain.SAFETY, null, null, null, 1.5, Instant.now()));
        assertTrue(exception.getMessage().contains("current: 1.5"));
    }

    @Test
    void constructor_NullCollections_BecomeEmpty() {
        // When
        AnalysisResult result = new AnalysisResult(AnalysisDomain.NETWORK, null, null, null, 0.5, Instant.now());

        // Then
        assertTrue(result.metrics().isEmpty());
        assertTrue(result.alerts().isEmpty());
        assertTrue(result.recommendations().isEmpty());
    }

    @Test
    void alert_BlankMessage_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> Alert.of(AlertLevel.LOW, " ", AnalysisDomain.SAFETY));
    }
}

package com.ryuqq.aar.testkit.contract;

import com.ryuqq.aar.core.engine.AnalysisResult;
import com.ryuqq.aar.core.model.AnalysisDomain;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScriptedEngine tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ScriptedEngineTest {

    private static final AnalysisDomain DOMAIN = AnalysisDomain.of("SAFETY");

    @Test
    void testSucceeding_ReturnsResultAndRecordsInvocation() {
        // Given
        ScriptedEngine<String> engine = ScriptedEngine.succeeding(DOMAIN);

        // When
        AnalysisResult result = engine.analyze("sample", Map.of("threshold", 3));

        // Then
        assertEquals(DOMAIN, result.domain());
        assertEquals("sample", result.metrics().get("input"));
        assertEquals(List.of("sample"), engine.invocations());
        assertEquals(Map.of("threshold", 3), engine.lastConfig());
    }

    @Test
    void testFailing_ThrowsConfiguredException() {
        // Given
        IllegalStateException failure = new IllegalStateException("boom");
        ScriptedEngine<String> engine = ScriptedEngine.failing(DOMAIN, failure);

        // When & Then
        IllegalStateException thrown = assertThrows(IllegalStateException.class,
            () -> engine.analyze("sample", Map.of()));
        assertSame(failure, thrown);
        assertEquals(1, engine.invocationCount());
    }

    @Test
    void testBlocking_ReleasedFromOtherThread_Returns() throws InterruptedException {
        // Given
        ScriptedEngine<String> engine = ScriptedEngine.blocking(DOMAIN);
        AtomicReference<AnalysisResult> result = new AtomicReference<>();
        Thread worker = new Thread(() -> result.set(engine.analyze("sample", Map.of())));

        // When
        worker.start();
        assertTrue(engine.awaitInvocations(1, Duration.ofSeconds(2)));
        engine.release();
        worker.join(2000);

        // Then
        assertNotNull(result.get());
        assertEquals(1, engine.maxConcurrentInvocations());
    }

    @Test
    void testBlocking_Interrupted_CountsInterruption() throws InterruptedException {
        // Given
        ScriptedEngine<String> engine = ScriptedEngine.blocking(DOMAIN);
        AtomicReference<RuntimeException> error = new AtomicReference<>();
        Thread worker = new Thread(() -> {
            try {
                engine.analyze("sample", Map.of());
            } catch (RuntimeException e) {
                error.set(e);
            }
        });

        // When
        worker.start();
        assertTrue(engine.awaitInvocations(1, Duration.ofSeconds(2)));
        worker.interrupt();
        worker.join(2000);

        // Then
        assertInstanceOf(IllegalStateException.class, error.get());
        assertEquals(1, engine.interruptedInvocations());
    }

    @Test
    void testFactory_NullArguments_Throw() {
        assertThrows(IllegalArgumentException.class, () -> ScriptedEngine.succeeding(null));
        assertThrows(IllegalArgumentException.class, () -> ScriptedEngine.failing(DOMAIN, null));
    }
}

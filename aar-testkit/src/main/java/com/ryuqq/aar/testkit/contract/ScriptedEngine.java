package com.ryuqq.aar.testkit.contract;

import com.ryuqq.aar.core.engine.AnalysisEngine;
import com.ryuqq.aar.core.engine.AnalysisResult;
import com.ryuqq.aar.core.model.AnalysisDomain;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted AnalysisEngine for testing purposes.
 *
 * <p>Records the data of every invocation in call order and behaves according to
 * its script: succeed, fail, or block until released.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedEngine&lt;String&gt; engine = ScriptedEngine.blocking(AnalysisDomain.SAFETY);
 * orchestrator.registerEngine(AnalysisDomain.SAFETY, engine);
 * orchestrator.submitTask(AnalysisDomain.SAFETY, "dataset-1");
 *
 * engine.awaitInvocations(1, Duration.ofSeconds(1));
 * engine.release();
 * </pre>
 *
 * @param <D> data type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedEngine<D> implements AnalysisEngine<D> {

    private enum Script { SUCCEED, FAIL, BLOCK }

    private final AnalysisDomain domain;
    private final Script script;
    private final RuntimeException failure;
    private final CountDownLatch release = new CountDownLatch(1);
    private final List<D> invocations = new ArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final AtomicInteger interrupted = new AtomicInteger();
    private volatile Map<String, Object> lastConfig = Map.of();

    private ScriptedEngine(AnalysisDomain domain, Script script, RuntimeException failure) {
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        this.domain = domain;
        this.script = script;
        this.failure = failure;
    }

    /**
     * Engine that returns a result immediately.
     */
    public static <D> ScriptedEngine<D> succeeding(AnalysisDomain domain) {
        return new ScriptedEngine<>(domain, Script.SUCCEED, null);
    }

    /**
     * Engine that throws the given exception.
     */
    public static <D> ScriptedEngine<D> failing(AnalysisDomain domain, RuntimeException failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        return new ScriptedEngine<>(domain, Script.FAIL, failure);
    }

    /**
     * Engine that blocks until {@link #release()} is called, then returns a result.
     *
     * <p>An interrupt ends the wait with an {@link IllegalStateException}.</p>
     */
    public static <D> ScriptedEngine<D> blocking(AnalysisDomain domain) {
        return new ScriptedEngine<>(domain, Script.BLOCK, null);
    }

    @Override
    public AnalysisResult analyze(D data, Map<String, Object> config) {
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        synchronized (this) {
            invocations.add(data);
            lastConfig = config;
            notifyAll();
        }
        try {
            switch (script) {
                case FAIL:
                    throw failure;
                case BLOCK:
                    awaitRelease();
                    break;
                default:
                    break;
            }
            return AnalysisResult.of(domain, Map.of("input", String.valueOf(data)));
        } finally {
            inFlight.decrementAndGet();
        }
    }

    /**
     * Releases every blocked and future invocation.
     */
    public void release() {
        release.countDown();
    }

    public synchronized List<D> invocations() {
        return List.copyOf(invocations);
    }

    public synchronized int invocationCount() {
        return invocations.size();
    }

    public int maxConcurrentInvocations() {
        return maxInFlight.get();
    }

    public int interruptedInvocations() {
        return interrupted.get();
    }

    public Map<String, Object> lastConfig() {
        return lastConfig;
    }

    /**
     * Waits until the engine was invoked at least {@code count} times.
     *
     * @param count minimum invocations
     * @param timeout maximum wait
     * @return true if reached before the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public synchronized boolean awaitInvocations(int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (invocations.size() < count) {
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMs <= 0) {
                return false;
            }
            wait(remainingMs);
        }
        return true;
    }

    private void awaitRelease() {
        try {
            if (!release.await(30, TimeUnit.SECONDS)) {
                throw new IllegalStateException("ScriptedEngine was never released");
            }
        } catch (InterruptedException e) {
            interrupted.incrementAndGet();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Analysis interrupted", e);
        }
    }

    @Override
    public String name() {
        return "ScriptedEngine[" + domain.getValue() + ", " + script + "]";
    }
}

package com.ryuqq.aar.adapter.runner;

/**
 * PriorityAnalysisOrchestrator 설정 (불변 record).
 *
 * <p>이 record는 스케줄러의 워커 수, 용량 한도, 폴링 간격, 종료 동작을 제어합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시 실행 워커 수 (기본 4)</li>
 *   <li>maxActiveTasks: 활성 Task(PENDING + RUNNING) 최대 수 (기본 1000)</li>
 *   <li>dispatchPollIntervalMs: 디스패치 루프의 큐 대기 간격 (기본 100ms)</li>
 *   <li>completionPollIntervalMs: analyzeAllDomains 완료 폴링 간격 (기본 100ms)</li>
 *   <li>interruptOnCancel: RUNNING Task 취소 시 워커 인터럽트 여부 (기본 false)</li>
 *   <li>defaultStopTimeoutMs: close() 시 사용할 종료 대기 시간 (기본 5000ms)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>CPU 집약 엔진: concurrency를 코어 수 이하로 유지</li>
 *   <li>낮은 지연: dispatchPollIntervalMs 감소 (100 → 10)</li>
 *   <li>협조적 엔진: interruptOnCancel 활성화로 취소 즉시 중단</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param concurrency 동시 실행 워커 수 (1 이상)
 * @param maxActiveTasks 활성 Task 최대 수 (1 이상)
 * @param dispatchPollIntervalMs 디스패치 큐 대기 간격 (밀리초, 양수)
 * @param completionPollIntervalMs 완료 폴링 간격 (밀리초, 양수)
 * @param interruptOnCancel RUNNING 취소 시 인터럽트 여부
 * @param defaultStopTimeoutMs 기본 종료 대기 시간 (밀리초, 0 이상)
 */
public record OrchestratorConfig(
    int concurrency,
    int maxActiveTasks,
    long dispatchPollIntervalMs,
    long completionPollIntervalMs,
    boolean interruptOnCancel,
    long defaultStopTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=4, maxActiveTasks=1000, dispatchPollIntervalMs=100ms,
     * completionPollIntervalMs=100ms, interruptOnCancel=false, defaultStopTimeoutMs=5000ms</p>
     */
    public OrchestratorConfig() {
        this(4, 1000, 100, 100, false, 5000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OrchestratorConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (maxActiveTasks <= 0) {
            throw new IllegalArgumentException(
                "maxActiveTasks must be positive (current: " + maxActiveTasks + ")"
            );
        }
        if (dispatchPollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "dispatchPollIntervalMs must be positive (current: " + dispatchPollIntervalMs + ")"
            );
        }
        if (completionPollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "completionPollIntervalMs must be positive (current: " + completionPollIntervalMs + ")"
            );
        }
        if (defaultStopTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "defaultStopTimeoutMs cannot be negative (current: " + defaultStopTimeoutMs + ")"
            );
        }
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withConcurrency(int concurrency) {
        return new OrchestratorConfig(concurrency, maxActiveTasks, dispatchPollIntervalMs,
            completionPollIntervalMs, interruptOnCancel, defaultStopTimeoutMs);
    }

    /**
     * maxActiveTasks만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withMaxActiveTasks(int maxActiveTasks) {
        return new OrchestratorConfig(concurrency, maxActiveTasks, dispatchPollIntervalMs,
            completionPollIntervalMs, interruptOnCancel, defaultStopTimeoutMs);
    }

    /**
     * dispatchPollIntervalMs만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withDispatchPollIntervalMs(long dispatchPollIntervalMs) {
        return new OrchestratorConfig(concurrency, maxActiveTasks, dispatchPollIntervalMs,
            completionPollIntervalMs, interruptOnCancel, defaultStopTimeoutMs);
    }

    /**
     * completionPollIntervalMs만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withCompletionPollIntervalMs(long completionPollIntervalMs) {
        return new OrchestratorConfig(concurrency, maxActiveTasks, dispatchPollIntervalMs,
            completionPollIntervalMs, interruptOnCancel, defaultStopTimeoutMs);
    }

    /**
     * interruptOnCancel만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withInterruptOnCancel(boolean interruptOnCancel) {
        return new OrchestratorConfig(concurrency, maxActiveTasks, dispatchPollIntervalMs,
            completionPollIntervalMs, interruptOnCancel, defaultStopTimeoutMs);
    }

    /**
     * defaultStopTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withDefaultStopTimeoutMs(long defaultStopTimeoutMs) {
        return new OrchestratorConfig(concurrency, maxActiveTasks, dispatchPollIntervalMs,
            completionPollIntervalMs, interruptOnCancel, defaultStopTimeoutMs);
    }
}

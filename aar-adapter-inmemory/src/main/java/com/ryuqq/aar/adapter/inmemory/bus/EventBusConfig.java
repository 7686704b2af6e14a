package com.ryuqq.aar.adapter.inmemory.bus;

/**
 * InMemoryEventBus 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>workerThreads: 전달 lane 수 (lane당 스레드 1개, 기본 4)</li>
 *   <li>queueCapacity: lane별 큐 용량 (기본 1000)</li>
 *   <li>publishTimeoutMs: 큐가 가득 찼을 때 publish가 기다리는 최대 시간 (기본 1000ms)</li>
 *   <li>historySize: 보관할 최근 이벤트 수 (기본 1000, 0이면 보관 안 함)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param workerThreads lane 수 (1 이상)
 * @param queueCapacity lane별 큐 용량 (1 이상)
 * @param publishTimeoutMs publish 대기 시간 (밀리초, 0 이상)
 * @param historySize 이벤트 이력 크기 (0 이상)
 */
public record EventBusConfig(
    int workerThreads,
    int queueCapacity,
    long publishTimeoutMs,
    int historySize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: workerThreads=4, queueCapacity=1000, publishTimeoutMs=1000ms, historySize=1000</p>
     */
    public EventBusConfig() {
        this(4, 1000, 1000, 1000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public EventBusConfig {
        if (workerThreads <= 0) {
            throw new IllegalArgumentException(
                "workerThreads must be positive (current: " + workerThreads + ")"
            );
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException(
                "queueCapacity must be positive (current: " + queueCapacity + ")"
            );
        }
        if (publishTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "publishTimeoutMs cannot be negative (current: " + publishTimeoutMs + ")"
            );
        }
        if (historySize < 0) {
            throw new IllegalArgumentException(
                "historySize cannot be negative (current: " + historySize + ")"
            );
        }
    }

    /**
     * workerThreads만 변경한 새 인스턴스 생성.
     */
    public EventBusConfig withWorkerThreads(int workerThreads) {
        return new EventBusConfig(workerThreads, queueCapacity, publishTimeoutMs, historySize);
    }

    /**
     * queueCapacity만 변경한 새 인스턴스 생성.
     */
    public EventBusConfig withQueueCapacity(int queueCapacity) {
        return new EventBusConfig(workerThreads, queueCapacity, publishTimeoutMs, historySize);
    }

    /**
     * publishTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public EventBusConfig withPublishTimeoutMs(long publishTimeoutMs) {
        return new EventBusConfig(workerThreads, queueCapacity, publishTimeoutMs, historySize);
    }

    /**
     * historySize만 변경한 새 인스턴스 생성.
     */
    public EventBusConfig withHistorySize(int historySize) {
        return new EventBusConfig(workerThreads, queueCapacity, publishTimeoutMs, historySize);
    }
}

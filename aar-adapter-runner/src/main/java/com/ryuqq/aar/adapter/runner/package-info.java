/**
 * Runner Adapter Layer - AnalysisOrchestrator 구현체.
 *
 * <p>이 패키지는 AnalysisOrchestrator 인터페이스의 구체적인 구현체를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.aar.adapter.runner.PriorityAnalysisOrchestrator} - 우선순위 큐 + 고정 워커 풀 오케스트레이터</li>
 *   <li>{@link com.ryuqq.aar.adapter.runner.PriorityTaskDispatcher} - 디스패치 루프 (DispatchRuntime 구현)</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (PriorityAnalysisOrchestrator)
 *   ↓ implements
 * application (AnalysisOrchestrator, DispatchRuntime)
 *   ↓ depends on
 * core (Task, TaskStatus, Event, AnalysisEngine)
 *   ↓ depends on
 * core/spi (EventBus interface)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.aar.adapter.runner;

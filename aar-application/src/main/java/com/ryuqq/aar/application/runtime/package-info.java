/**
 * DispatchRuntime 인터페이스.
 *
 * <p>이 패키지는 우선순위 큐에서 Task를 꺼내 워커에 넘기는 디스패치 사이클을 정의합니다.</p>
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.aar.application.runtime.DispatchRuntime} - 디스패치 한 사이클</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 aar-adapter-runner 모듈의 {@code PriorityTaskDispatcher}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.aar.application.runtime;

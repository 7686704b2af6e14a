/**
 * AAR Application Layer - 분석 Task 조정 API.
 *
 * <p>이 패키지는 분석 엔진 등록, 우선순위 Task 제출, 취소, 상태 조회 등
 * 클라이언트가 사용하는 포트를 정의합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.aar.application.orchestrator.AnalysisOrchestrator} - 분석 Task 실행 조정자</li>
 *   <li>{@link com.ryuqq.aar.application.orchestrator.TaskCallback} - Task 완료 콜백</li>
 *   <li>{@link com.ryuqq.aar.application.orchestrator.QueueStatus} - 큐 상태 스냅샷</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 aar-adapter-runner 모듈에 위치</li>
 *   <li><strong>불변성:</strong> 조회 결과는 모두 불변 스냅샷</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.aar.application.orchestrator;

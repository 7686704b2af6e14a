package com.ryuqq.aar.core.statemachine;

/**
 * 분석 Task의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING (디스패치)</li>
 *   <li>PENDING → CANCELLED (디스패치 전 취소)</li>
 *   <li>RUNNING → COMPLETED (성공)</li>
 *   <li>RUNNING → FAILED (엔진 예외)</li>
 *   <li>RUNNING → CANCELLED (실행 중 취소 또는 종료)</li>
 *   <li><strong>종료 상태에서 벗어나는 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING ──────────────► CANCELLED
 *    │                        ▲
 *    ▼ (디스패치)              │
 * RUNNING ────────────────────┤
 *    │
 *    ├─► COMPLETED (성공)
 *    │
 *    └─► FAILED (실패)
 *
 * 금지된 전이:
 * - COMPLETED → * ❌
 * - FAILED → * ❌
 * - CANCELLED → * ❌
 * - RUNNING → PENDING ❌
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TaskStatus {

    /**
     * 대기 중 (우선순위 큐에 있음).
     */
    PENDING,

    /**
     * 실행 중 (엔진 호출 진행).
     */
    RUNNING,

    /**
     * 완료 (성공).
     */
    COMPLETED,

    /**
     * 실패 (엔진 예외).
     */
    FAILED,

    /**
     * 취소됨.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(COMPLETED, FAILED, CANCELLED)에서는 더 이상 다른 상태로 전이할 수 없습니다.</p>
     *
     * @return COMPLETED, FAILED 또는 CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * 취소 가능한 상태인지 확인.
     *
     * @return PENDING 또는 RUNNING인 경우 true
     */
    public boolean isCancellable() {
        return this == PENDING || this == RUNNING;
    }
}

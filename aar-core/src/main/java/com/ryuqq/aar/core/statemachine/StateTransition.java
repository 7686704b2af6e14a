package com.ryuqq.aar.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p>이 클래스는 Task의 상태 전이가 허용된 규칙을 따르는지
 * 검증하고, 단조 증가 불변식을 보장합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING</li>
 *   <li>PENDING → CANCELLED</li>
 *   <li>RUNNING → COMPLETED</li>
 *   <li>RUNNING → FAILED</li>
 *   <li>RUNNING → CANCELLED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(COMPLETED, FAILED, CANCELLED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>역방향 전이 불가 (예: RUNNING → PENDING)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 확인 (예외 없이).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 전이인 경우 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(TaskStatus from, TaskStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        return switch (from) {
            case PENDING -> to == TaskStatus.RUNNING || to == TaskStatus.CANCELLED;
            case RUNNING -> to == TaskStatus.COMPLETED || to == TaskStatus.FAILED || to == TaskStatus.CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * <p>허용되지 않은 전이를 시도하면 {@link IllegalStateException}을 발생시킵니다.</p>
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(TaskStatus from, TaskStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        // 종료 상태에서는 어디로도 전이 불가
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static TaskStatus transition(TaskStatus current, TaskStatus next) {
        validate(current, next);
        return next;
    }
}

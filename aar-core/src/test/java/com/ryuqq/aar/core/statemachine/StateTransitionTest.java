package com.ryuqq.aar.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.aar.core.statemachine.TaskStatus.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * <ul>
 *   <li>정상 전이 (PENDING → RUNNING → COMPLETED/FAILED/CANCELLED) 성공</li>
 *   <li>PENDING → CANCELLED 성공</li>
 *   <li>종료 상태에서의 전이 시 IllegalStateException</li>
 *   <li>역방향 전이 시 IllegalStateException</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_PendingToRunning_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(PENDING, RUNNING));
    }

    @Test
    void validate_PendingToCancelled_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(PENDING, CANCELLED));
    }

    @Test
    void validate_RunningToTerminal_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(RUNNING, COMPLETED));
        assertDoesNotThrow(() -> StateTransition.validate(RUNNING, FAILED));
        assertDoesNotThrow(() -> StateTransition.validate(RUNNING, CANCELLED));
    }

    @Test
    void transition_NormalFlowToCompleted_Succeeds() {
        // Given
        TaskStatus state = PENDING;

        // When
        state = StateTransition.transition(state, RUNNING);
        state = StateTransition.transition(state, COMPLETED);

        // Then
        assertEquals(COMPLETED, state);
        assertTrue(state.isTerminal());
    }

    // ========== 종료 상태 전이 금지 ==========

    @Test
    void validate_CompletedToRunning_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> StateTransition.validate(COMPLETED, RUNNING));
        assertTrue(exception.getMessage().contains("terminal state"));
    }

    @Test
    void validate_CancelledToCompleted_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(CANCELLED, COMPLETED));
    }

    @Test
    void validate_FailedToCompleted_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(FAILED, COMPLETED));
    }

    // ========== 허용되지 않는 전이 ==========

    @Test
    void validate_RunningToPending_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> StateTransition.validate(RUNNING, PENDING));
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_PendingToCompleted_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(PENDING, COMPLETED));
    }

    @Test
    void isAllowed_NullState_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> StateTransition.isAllowed(null, RUNNING));
    }

    @Test
    void isAllowed_TerminalStates_ReturnsFalse() {
        // When & Then
        for (TaskStatus to : TaskStatus.values()) {
            assertFalse(StateTransition.isAllowed(COMPLETED, to));
            assertFalse(StateTransition.isAllowed(FAILED, to));
            assertFalse(StateTransition.isAllowed(CANCELLED, to));
        }
    }
}

/**
 * Task lifecycle state machine.
 *
 * <p>{@link com.ryuqq.aar.core.statemachine.TaskStatus} enumerates the lifecycle states and
 * {@link com.ryuqq.aar.core.statemachine.StateTransition} guards the allowed transitions.
 * Terminal states (COMPLETED, FAILED, CANCELLED) never change again.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.aar.core.statemachine;

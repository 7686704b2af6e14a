package com.ryuqq.aar.application.runtime;

/**
 * Task Dispatch Runtime.
 *
 * <p>This interface defines one cycle of the scheduler's dispatch loop.</p>
 *
 * <p><strong>Dispatch Flow:</strong></p>
 * <pre>
 * pump() starts
 *   ↓
 * 1. Acquire a worker permit (wait for a free worker)
 * 2. Take the most urgent task from the priority queue
 *    - none within the poll interval → release permit, return false
 *    - task already CANCELLED → release permit, return true
 * 3. PENDING → RUNNING under the orchestrator guard, capture engine
 * 4. Hand off to the worker pool (analyze() runs outside the guard)
 * 5. Worker records the terminal outcome and releases the permit
 * </pre>
 *
 * <p><strong>Ordering:</strong> The permit is taken before the task, so the
 * priority comparison happens when a worker is actually free.</p>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>pump() is invoked repeatedly by a single dispatcher thread</li>
 *   <li>Per-task failures are recorded on the task, never thrown from pump()</li>
 *   <li>Interrupting the dispatcher thread ends the loop cleanly</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DispatchRuntime {

    /**
     * Executes a single dispatch cycle.
     *
     * @return true if a queued task was taken (dispatched or skipped), false if the queue was idle
     * @throws IllegalStateException if the runtime was interrupted while waiting
     */
    boolean pump();
}

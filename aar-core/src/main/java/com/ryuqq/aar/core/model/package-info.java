/**
 * Core domain model package.
 *
 * <p>Immutable value objects describing analysis work.</p>
 *
 * <h2>Main Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.aar.core.model.TaskId} - Unique task identifier</li>
 *   <li>{@link com.ryuqq.aar.core.model.AnalysisDomain} - Analysis category (SAFETY, NETWORK, ...)</li>
 *   <li>{@link com.ryuqq.aar.core.model.TaskPriority} - Named priority levels (lower value runs first)</li>
 *   <li>{@link com.ryuqq.aar.core.model.Task} - Unit of analysis work, ordered by (priority, sequence)</li>
 *   <li>{@link com.ryuqq.aar.core.model.TaskResult} - Immutable lifecycle snapshot returned by queries</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable after construction</li>
 *   <li><strong>Fail-fast validation:</strong> Invalid input is rejected in the constructor</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.aar.core.model;

/**
 * Event model for the notification bus.
 *
 * <h2>Main Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.aar.core.event.EventType} - Open set of event type names</li>
 *   <li>{@link com.ryuqq.aar.core.event.EventPayload} - Structured payload (task id, domain, result, error, attributes)</li>
 *   <li>{@link com.ryuqq.aar.core.event.Event} - Immutable envelope with id, source and timestamp</li>
 *   <li>{@link com.ryuqq.aar.core.event.EventHandler} - Subscriber callback</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.aar.core.event;

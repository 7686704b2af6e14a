/**
 * In-memory EventBus adapter providing asynchronous, failure-isolated event delivery.
 *
 * <p>This package contains the reference implementation of the {@link com.ryuqq.aar.core.spi.EventBus}
 * SPI interface using in-memory data structures.</p>
 *
 * <h2>Architecture</h2>
 *
 * <ul>
 *   <li><strong>Subscription Registry:</strong> explicit map (event type → handler id → subscription)</li>
 *   <li><strong>Dispatch Lanes:</strong> {@link java.util.concurrent.ArrayBlockingQueue} plus one daemon thread each</li>
 *   <li><strong>History:</strong> bounded {@link java.util.ArrayDeque} of recently delivered events</li>
 * </ul>
 *
 * <h2>Event Lifecycle</h2>
 *
 * <pre>
 * ┌─────────────┐
 * │   publish   │ (caller thread, bounded wait for queue space)
 * └──────┬──────┘
 *        │ routed by publishing thread
 *        ▼
 * ┌─────────────┐
 * │    lane     │ (FIFO, one worker)
 * └──────┬──────┘
 *        │
 *        ▼
 * ┌─────────────┐
 * │   deliver   │ → handlers in ascending priority
 * └──────┬──────┘
 *        │
 *        ├──► handler ok ─────────────────► call count +1
 *        │
 *        └──► handler throws ─────────────► logged, error count +1, HANDLER_FAILED published
 * </pre>
 *
 * <h2>Limitations</h2>
 *
 * <ul>
 *   <li><strong>In-Memory Only:</strong> queued events are lost on process exit</li>
 *   <li><strong>No Global Order:</strong> events from different publishing threads may interleave</li>
 * </ul>
 *
 * @see com.ryuqq.aar.core.spi.EventBus
 * @see com.ryuqq.aar.adapter.inmemory.bus.InMemoryEventBus
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.aar.adapter.inmemory.bus;

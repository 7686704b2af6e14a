/**
 * Exception taxonomy.
 *
 * <p>Every exception extends {@link com.ryuqq.aar.core.exception.AnalysisException}
 * and carries a stable error code (AAR-CONFIG, AAR-CAPACITY, AAR-NOT-FOUND, AAR-ENGINE,
 * AAR-CALLBACK, AAR-SHUTDOWN, AAR-BUS).</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.aar.core.exception;

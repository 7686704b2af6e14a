/**
 * Analysis engine contract.
 *
 * <p>An {@link com.ryuqq.aar.core.engine.AnalysisEngine} turns a data payload and a
 * per-task configuration map into an {@link com.ryuqq.aar.core.engine.AnalysisResult}.
 * Engines are registered per {@link com.ryuqq.aar.core.model.AnalysisDomain}; one engine
 * per domain.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.aar.core.engine;

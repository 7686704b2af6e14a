package com.ryuqq.aar.core.engine;

/**
 * 분석 결과 경보의 심각도.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum AlertLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}

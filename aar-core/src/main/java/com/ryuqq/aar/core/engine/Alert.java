package com.ryuqq.aar.core.engine;

import com.ryuqq.aar.core.model.AnalysisDomain;

import java.time.Instant;
import java.util.Map;

/**
 * 분석 중 임계값 위반으로 생성된 경보.
 *
 * @param level 심각도
 * @param message 경보 메시지
 * @param domain 경보를 생성한 도메인
 * @param timestamp 생성 시각
 * @param details 추가 정보 (불변, 빈 Map 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Alert(
    AlertLevel level,
    String message,
    AnalysisDomain domain,
    Instant timestamp,
    Map<String, Object> details
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 message가 빈 문자열인 경우
     */
    public Alert {
        if (level == null) {
            throw new IllegalArgumentException("level cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    /**
     * 현재 시각으로 Alert 생성 (details 없음).
     *
     * @param level 심각도
     * @param message 경보 메시지
     * @param domain 도메인
     * @return Alert 인스턴스
     */
    public static Alert of(AlertLevel level, String message, AnalysisDomain domain) {
        return new Alert(level, message, domain, Instant.now(), Map.of());
    }
}

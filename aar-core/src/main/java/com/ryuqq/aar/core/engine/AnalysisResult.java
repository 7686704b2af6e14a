package com.ryuqq.aar.core.engine;

import com.ryuqq.aar.core.model.AnalysisDomain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 분석 엔진 실행 결과.
 *
 * <p>엔진이 {@link AnalysisEngine#analyze(Object, Map)} 호출 한 번에 반환하는 값입니다.
 * 부분/스트리밍 결과는 없습니다.</p>
 *
 * @param domain 결과를 생성한 도메인
 * @param metrics 계산된 지표 (불변, 삽입 순서 유지)
 * @param alerts 생성된 경보 목록 (불변)
 * @param recommendations 권고 사항 (불변)
 * @param confidenceScore 신뢰도 (0.0 ~ 1.0)
 * @param analysisTimestamp 분석 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AnalysisResult(
    AnalysisDomain domain,
    Map<String, Object> metrics,
    List<Alert> alerts,
    List<String> recommendations,
    double confidenceScore,
    Instant analysisTimestamp
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException domain 또는 analysisTimestamp가 null이거나 confidenceScore가 범위를 벗어난 경우
     */
    public AnalysisResult {
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        if (analysisTimestamp == null) {
            throw new IllegalArgumentException("analysisTimestamp cannot be null");
        }
        if (confidenceScore < 0.0 || confidenceScore > 1.0) {
            throw new IllegalArgumentException("confidenceScore must be between 0.0 and 1.0 (current: " + confidenceScore + ")");
        }
        metrics = metrics == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    /**
     * 지표만 가진 결과 생성 (경보/권고 없음, 신뢰도 1.0).
     *
     * @param domain 도메인
     * @param metrics 지표
     * @return AnalysisResult 인스턴스
     */
    public static AnalysisResult of(AnalysisDomain domain, Map<String, Object> metrics) {
        return new AnalysisResult(domain, metrics, List.of(), List.of(), 1.0, Instant.now());
    }

    /**
     * 주어진 심각도 이상의 경보 수.
     *
     * @param minimum 최소 심각도
     * @return 경보 수
     */
    public long countAlertsAtLeast(AlertLevel minimum) {
        return alerts.stream()
            .filter(alert -> alert.level().compareTo(minimum) >= 0)
            .count();
    }
}

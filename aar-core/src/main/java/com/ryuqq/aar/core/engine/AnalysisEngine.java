package com.ryuqq.aar.core.engine;

import java.util.Map;

/**
 * 분석 엔진 (외부 협력자).
 *
 * <p>도메인별 통계 분석을 수행하는 플러그형 컴포넌트입니다.
 * 오케스트레이터는 엔진을 불투명한 동기 호출로 취급하며, Task 하나당 정확히 한 번 호출합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>analyze()는 블로킹 호출이며 부분 결과를 반환하지 않습니다.</li>
 *   <li>예외를 던지면 해당 Task는 FAILED로 기록됩니다.</li>
 *   <li>서로 다른 Task에 대해 동시에 호출될 수 있습니다.</li>
 *   <li>실행 중 취소 요청으로 중단되지 않을 수 있습니다 (협력적 취소).</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * AnalysisEngine&lt;TelemetryFrame&gt; safety = (data, config) -&gt; {
 *     double threshold = (double) config.getOrDefault("fallThreshold", 5.0);
 *     return AnalysisResult.of(AnalysisDomain.SAFETY, Map.of("falls", data.countFalls(threshold)));
 * };
 * orchestrator.registerEngine(AnalysisDomain.SAFETY, safety);
 * </pre>
 *
 * @param <D> 분석 데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AnalysisEngine<D> {

    /**
     * 데이터 분석 수행.
     *
     * @param data 분석 대상 데이터
     * @param config 분석 설정 (불변, 빈 Map 가능)
     * @return 분석 결과
     */
    AnalysisResult analyze(D data, Map<String, Object> config);

    /**
     * 로깅 및 이벤트에 사용할 엔진 이름.
     *
     * @return 엔진 이름 (기본: 구현 클래스의 단순 이름)
     */
    default String name() {
        return getClass().getSimpleName();
    }
}

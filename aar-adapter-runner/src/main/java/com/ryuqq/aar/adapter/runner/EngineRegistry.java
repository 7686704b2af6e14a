package com.ryuqq.aar.adapter.runner;

import com.ryuqq.aar.core.engine.AnalysisEngine;
import com.ryuqq.aar.core.model.AnalysisDomain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 도메인 → 엔진 레지스트리 (도메인당 엔진 1개).
 *
 * <p>thread-safe하지 않습니다. 오케스트레이터의 lock 안에서만 사용됩니다.</p>
 *
 * @param <D> 데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class EngineRegistry<D> {

    private final Map<AnalysisDomain, AnalysisEngine<D>> engines = new LinkedHashMap<>();

    /**
     * 등록 또는 교체.
     *
     * @return 교체된 기존 엔진, 없으면 null
     */
    AnalysisEngine<D> register(AnalysisDomain domain, AnalysisEngine<D> engine) {
        return engines.put(domain, engine);
    }

    boolean unregister(AnalysisDomain domain) {
        return engines.remove(domain) != null;
    }

    AnalysisEngine<D> find(AnalysisDomain domain) {
        return engines.get(domain);
    }

    boolean contains(AnalysisDomain domain) {
        return engines.containsKey(domain);
    }

    int size() {
        return engines.size();
    }

    Set<AnalysisDomain> domains() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(engines.keySet()));
    }
}

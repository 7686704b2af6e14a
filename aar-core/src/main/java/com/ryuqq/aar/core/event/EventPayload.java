package com.ryuqq.aar.core.event;

import com.ryuqq.aar.core.engine.AnalysisResult;
import com.ryuqq.aar.core.model.AnalysisDomain;
import com.ryuqq.aar.core.model.TaskId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 모든 이벤트가 공통으로 사용하는 구조화된 페이로드.
 *
 * <p>Task 관련 필드(taskId, domain, result, error)는 선택 값이며,
 * 그 밖의 정보는 불변 attributes Map에 담습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * EventPayload payload = EventPayload.forTask(taskId, domain)
 *     .withAttribute("priority", 2);
 *
 * EventPayload failure = EventPayload.forTask(taskId, domain)
 *     .withError("engine exploded");
 * </pre>
 *
 * @param taskId 관련 Task ID (null 가능)
 * @param domain 관련 도메인 (null 가능)
 * @param result 분석 결과 (null 가능)
 * @param error 오류 메시지 (null 가능)
 * @param attributes 추가 속성 (불변, 삽입 순서 유지)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EventPayload(
    TaskId taskId,
    AnalysisDomain domain,
    AnalysisResult result,
    String error,
    Map<String, Object> attributes
) {

    private static final EventPayload EMPTY = new EventPayload(null, null, null, null, Map.of());

    /**
     * Compact Constructor.
     */
    public EventPayload {
        attributes = attributes == null || attributes.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * 빈 페이로드.
     *
     * @return 모든 필드가 비어 있는 페이로드
     */
    public static EventPayload empty() {
        return EMPTY;
    }

    /**
     * Task 관련 페이로드 생성.
     *
     * @param taskId Task ID
     * @param domain 도메인
     * @return EventPayload 인스턴스
     */
    public static EventPayload forTask(TaskId taskId, AnalysisDomain domain) {
        return new EventPayload(taskId, domain, null, null, Map.of());
    }

    /**
     * 도메인 관련 페이로드 생성.
     *
     * @param domain 도메인
     * @return EventPayload 인스턴스
     */
    public static EventPayload forDomain(AnalysisDomain domain) {
        return new EventPayload(null, domain, null, null, Map.of());
    }

    /**
     * 속성 하나를 추가한 새 페이로드.
     *
     * @param key 속성 키
     * @param value 속성 값
     * @return 새 EventPayload
     * @throws IllegalArgumentException key가 null이거나 빈 문자열인 경우
     */
    public EventPayload withAttribute(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        copy.put(key, value);
        return new EventPayload(taskId, domain, result, error, copy);
    }

    /**
     * 분석 결과를 담은 새 페이로드.
     */
    public EventPayload withResult(AnalysisResult result) {
        return new EventPayload(taskId, domain, result, error, attributes);
    }

    /**
     * 오류 메시지를 담은 새 페이로드.
     */
    public EventPayload withError(String error) {
        return new EventPayload(taskId, domain, result, error, attributes);
    }

    public Optional<TaskId> findTaskId() {
        return Optional.ofNullable(taskId);
    }

    public Optional<AnalysisDomain> findDomain() {
        return Optional.ofNullable(domain);
    }

    public Optional<AnalysisResult> findResult() {
        return Optional.ofNullable(result);
    }

    public Optional<String> findError() {
        return Optional.ofNullable(error);
    }

    /**
     * 속성 조회.
     *
     * @param key 속성 키
     * @return 속성 값 (없으면 empty)
     */
    public Optional<Object> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }
}

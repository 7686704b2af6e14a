package com.ryuqq.aar.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 분석 Task (불변 작업 기술자).
 *
 * <p>Task는 특정 도메인 엔진을 데이터에 대해 한 번 실행하는 작업 단위입니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>taskId:</strong> Task 고유 식별자</li>
 *   <li><strong>domain:</strong> 처리할 엔진을 선택하는 분석 도메인</li>
 *   <li><strong>data:</strong> 엔진에 전달할 불투명 데이터 참조</li>
 *   <li><strong>config:</strong> 엔진 설정 (불변 Map)</li>
 *   <li><strong>priority:</strong> 우선순위 (작을수록 긴급)</li>
 *   <li><strong>sequence:</strong> 생성 순번 (단조 증가, FIFO tie-break 키)</li>
 *   <li><strong>createdAt:</strong> 생성 시각 (정렬에는 사용하지 않음)</li>
 * </ul>
 *
 * <p><strong>정렬:</strong> (priority 오름차순, sequence 오름차순). sequence가 고유하므로 전순서이며 동률이 없습니다.
 * 벽시계 시각은 해상도 동률이 생길 수 있어 정렬 키로 쓰지 않습니다.</p>
 *
 * <p><strong>동등성:</strong> taskId만으로 판단합니다.</p>
 *
 * @param <D> 데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Task<D> implements Comparable<Task<?>> {

    private final TaskId taskId;
    private final AnalysisDomain domain;
    private final D data;
    private final Map<String, Object> config;
    private final int priority;
    private final long sequence;
    private final Instant createdAt;

    private Task(TaskId taskId, AnalysisDomain domain, D data, Map<String, Object> config,
                 int priority, long sequence, Instant createdAt) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be non-negative (current: " + sequence + ")");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        this.taskId = taskId;
        this.domain = domain;
        this.data = data;
        this.config = config == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(config));
        this.priority = priority;
        this.sequence = sequence;
        this.createdAt = createdAt;
    }

    /**
     * Task 생성 (명시적 식별자와 시각 지정).
     *
     * @param taskId Task ID
     * @param domain 분석 도메인
     * @param data 분석 데이터 (null 허용)
     * @param config 엔진 설정 (null이면 빈 Map)
     * @param priority 우선순위
     * @param sequence 생성 순번
     * @param createdAt 생성 시각
     * @param <D> 데이터 타입
     * @return 생성된 Task
     * @throws IllegalArgumentException 필수 필드가 null이거나 sequence가 음수인 경우
     */
    public static <D> Task<D> of(TaskId taskId, AnalysisDomain domain, D data, Map<String, Object> config,
                                 int priority, long sequence, Instant createdAt) {
        return new Task<>(taskId, domain, data, config, priority, sequence, createdAt);
    }

    /**
     * 새 TaskId와 현재 시각으로 Task 생성.
     *
     * @param domain 분석 도메인
     * @param data 분석 데이터
     * @param config 엔진 설정
     * @param priority 우선순위
     * @param sequence 생성 순번
     * @param <D> 데이터 타입
     * @return 생성된 Task
     */
    public static <D> Task<D> create(AnalysisDomain domain, D data, Map<String, Object> config,
                                     int priority, long sequence) {
        return new Task<>(TaskId.generate(), domain, data, config, priority, sequence, Instant.now());
    }

    public TaskId getTaskId() {
        return taskId;
    }

    public AnalysisDomain getDomain() {
        return domain;
    }

    public D getData() {
        return data;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public int getPriority() {
        return priority;
    }

    public long getSequence() {
        return sequence;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public int compareTo(Task<?> other) {
        int byPriority = Integer.compare(priority, other.priority);
        if (byPriority != 0) {
            return byPriority;
        }
        return Long.compare(sequence, other.sequence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Task<?> task = (Task<?>) o;
        return taskId.equals(task.taskId);
    }

    @Override
    public int hashCode() {
        return taskId.hashCode();
    }

    @Override
    public String toString() {
        return "Task{id=" + taskId.getValue() + ", domain=" + domain.getValue()
            + ", priority=" + priority + ", sequence=" + sequence + '}';
    }
}

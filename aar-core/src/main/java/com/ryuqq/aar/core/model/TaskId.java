package com.ryuqq.aar.core.model;

import java.util.UUID;

/**
 * 분석 Task의 전역 고유 식별자.
 *
 * <p>TaskId는 제출된 모든 Task를 추적하는 데 사용되며,
 * 상태 조회, 취소, 이벤트 상관관계 키로 활용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskId {

    private final String value;

    private TaskId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("TaskId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("TaskId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("TaskId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * TaskId 생성.
     *
     * @param value TaskId 값
     * @return TaskId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static TaskId of(String value) {
        return new TaskId(value);
    }

    /**
     * 새로운 TaskId 생성 (UUID 기반).
     *
     * @return 무작위 UUID 값을 가진 TaskId
     */
    public static TaskId generate() {
        return new TaskId(UUID.randomUUID().toString());
    }

    /**
     * TaskId 값 조회.
     *
     * @return TaskId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskId taskId = (TaskId) o;
        return value.equals(taskId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "TaskId{" + value + '}';
    }
}

package com.ryuqq.aar.core.model;

import com.ryuqq.aar.core.engine.AnalysisResult;
import com.ryuqq.aar.core.statemachine.TaskStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Task 생명주기 기록의 불변 스냅샷.
 *
 * <p>오케스트레이터는 내부에 가변 기록을 유지하고, 조회 시 이 스냅샷만 반환합니다.
 * 따라서 호출자가 내부 상태를 변경할 수 없습니다.</p>
 *
 * <p><strong>필드 규칙:</strong></p>
 * <ul>
 *   <li>result: COMPLETED인 경우에만 non-null</li>
 *   <li>error: FAILED인 경우 non-null, 비어 있지 않음</li>
 *   <li>startedAt: RUNNING에 진입한 적이 있는 경우에만 non-null</li>
 *   <li>endedAt: 종료 상태인 경우에만 non-null</li>
 * </ul>
 *
 * @param taskId Task ID
 * @param domain 분석 도메인
 * @param status 현재 상태
 * @param priority 우선순위
 * @param result 성공 결과 (null 가능)
 * @param error 오류 메시지 (null 가능)
 * @param submittedAt 제출 시각
 * @param startedAt 실행 시작 시각 (null 가능)
 * @param endedAt 종료 시각 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskResult(
    TaskId taskId,
    AnalysisDomain domain,
    TaskStatus status,
    int priority,
    AnalysisResult result,
    String error,
    Instant submittedAt,
    Instant startedAt,
    Instant endedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public TaskResult {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (submittedAt == null) {
            throw new IllegalArgumentException("submittedAt cannot be null");
        }
    }

    public Optional<AnalysisResult> findResult() {
        return Optional.ofNullable(result);
    }

    public Optional<String> findError() {
        return Optional.ofNullable(error);
    }

    /**
     * 실행 시간 (startedAt ~ endedAt).
     *
     * <p>디스패치되지 않고 취소된 Task나 아직 실행 중인 Task는 empty를 반환합니다.</p>
     *
     * @return 실행 시간
     */
    public Optional<Duration> executionTime() {
        if (startedAt == null || endedAt == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(startedAt, endedAt));
    }

    /**
     * 종료 상태인지 확인.
     *
     * @return 종료 상태이면 true
     */
    public boolean isTerminal() {
        return status.isTerminal();
    }
}

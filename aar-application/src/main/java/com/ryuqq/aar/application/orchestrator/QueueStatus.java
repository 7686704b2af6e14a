package com.ryuqq.aar.application.orchestrator;

import java.time.Duration;

/**
 * 오케스트레이터 큐 상태 스냅샷.
 *
 * <p>{@link AnalysisOrchestrator#getQueueStatus()} 호출 시점의 카운트와 누적 지표를 담습니다.
 * 생성 후 변경되지 않습니다.</p>
 *
 * @param queued 우선순위 큐에 남아 있는 항목 수
 * @param pending PENDING 상태 Task 수
 * @param runningTasks RUNNING 상태 Task 수
 * @param active 활성 Task 수 (PENDING + RUNNING)
 * @param completed 종료 상태 Task 기록 수
 * @param registeredEngines 등록된 엔진 수
 * @param running 디스패치 루프 실행 여부
 * @param totalTasks 누적 제출 Task 수
 * @param successfulTasks 누적 COMPLETED 수
 * @param failedTasks 누적 FAILED 수
 * @param cancelledTasks 누적 CANCELLED 수
 * @param averageExecutionTime 성공/실패 Task의 평균 실행 시간
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record QueueStatus(
    int queued,
    int pending,
    int runningTasks,
    int active,
    int completed,
    int registeredEngines,
    boolean running,
    long totalTasks,
    long successfulTasks,
    long failedTasks,
    long cancelledTasks,
    Duration averageExecutionTime
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 카운트가 음수이거나 averageExecutionTime이 null인 경우
     */
    public QueueStatus {
        if (queued < 0 || pending < 0 || runningTasks < 0 || active < 0 || completed < 0 || registeredEngines < 0) {
            throw new IllegalArgumentException("counts must be non-negative");
        }
        if (totalTasks < 0 || successfulTasks < 0 || failedTasks < 0 || cancelledTasks < 0) {
            throw new IllegalArgumentException("metrics must be non-negative");
        }
        if (averageExecutionTime == null) {
            throw new IllegalArgumentException("averageExecutionTime cannot be null");
        }
    }

    /**
     * 성공률 (COMPLETED / 종료된 Task).
     *
     * @return 0.0 ~ 1.0, 종료된 Task가 없으면 0.0
     */
    public double successRate() {
        long finished = successfulTasks + failedTasks + cancelledTasks;
        if (finished == 0) {
            return 0.0;
        }
        return (double) successfulTasks / finished;
    }
}

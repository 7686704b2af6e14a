package com.ryuqq.aar.application.orchestrator;

import com.ryuqq.aar.core.engine.AnalysisResult;
import com.ryuqq.aar.core.model.TaskId;

/**
 * Task 완료 콜백.
 *
 * <p>Task가 COMPLETED 상태로 종료된 경우에만 워커 스레드에서 한 번 호출됩니다.
 * FAILED, CANCELLED로 종료된 Task에는 호출되지 않습니다.</p>
 *
 * <p><strong>실패 격리:</strong> 콜백이 예외를 던지면 오케스트레이터가
 * {@link com.ryuqq.aar.core.exception.CallbackException}으로 감싸 로그를 남기고
 * CALLBACK_FAILED 이벤트로 발행합니다. Task 상태는 COMPLETED로 유지됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TaskCallback {

    /**
     * 완료된 Task의 결과 전달.
     *
     * @param taskId 완료된 Task ID
     * @param result 분석 결과
     */
    void onComplete(TaskId taskId, AnalysisResult result);
}

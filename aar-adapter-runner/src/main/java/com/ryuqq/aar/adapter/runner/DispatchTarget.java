package com.ryuqq.aar.adapter.runner;

import com.ryuqq.aar.core.model.Task;

import java.util.concurrent.Future;

/**
 * 디스패처가 Task를 넘겨받을 대상 (오케스트레이터).
 *
 * @param <D> 데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
interface DispatchTarget<D> {

    /**
     * Task를 RUNNING으로 전이하고 워커에서 실행할 작업을 반환.
     *
     * @param task 큐에서 꺼낸 Task
     * @return 실행할 작업, 디스패치할 필요가 없으면(이미 취소됨 등) null
     */
    Runnable begin(Task<D> task);

    /**
     * 워커에 제출된 작업의 Future 연결 (강제 취소용).
     *
     * @param task Task
     * @param future 워커 Future
     */
    void attach(Task<D> task, Future<?> future);

    /**
     * 디스패치 사이클에서 발생한 예기치 않은 오류 통지.
     *
     * @param error 오류
     */
    void onDispatchError(RuntimeException error);
}

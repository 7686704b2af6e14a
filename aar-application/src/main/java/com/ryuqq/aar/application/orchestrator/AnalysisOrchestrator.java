package com.ryuqq.aar.application.orchestrator;

import com.ryuqq.aar.core.engine.AnalysisEngine;
import com.ryuqq.aar.core.engine.AnalysisResult;
import com.ryuqq.aar.core.model.AnalysisDomain;
import com.ryuqq.aar.core.model.TaskId;
import com.ryuqq.aar.core.model.TaskPriority;
import com.ryuqq.aar.core.model.TaskResult;
import com.ryuqq.aar.core.statemachine.TaskStatus;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 분석 Task 실행 조정자.
 *
 * <p>도메인별 분석 엔진을 등록받고, 우선순위가 있는 Task를 수락하여
 * 호출자를 블로킹하지 않고 제한된 워커 풀에서 실행합니다.
 * 생명주기 변화는 {@link com.ryuqq.aar.core.spi.EventBus}로 발행됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * orchestrator.registerEngine(AnalysisDomain.SAFETY, safetyEngine);
 * orchestrator.start();
 *
 * TaskId taskId = orchestrator.submitTask(AnalysisDomain.SAFETY, dataset, Map.of(), TaskPriority.HIGH);
 *
 * TaskStatus status = orchestrator.getTaskStatus(taskId);
 * Optional&lt;TaskResult&gt; result = orchestrator.getTaskResult(taskId);
 *
 * orchestrator.stop(Duration.ofSeconds(5));
 * </pre>
 *
 * <p><strong>동기 오류:</strong></p>
 * <ul>
 *   <li>엔진 미등록 → {@link com.ryuqq.aar.core.exception.ConfigurationException}</li>
 *   <li>활성 Task 한도 초과 → {@link com.ryuqq.aar.core.exception.CapacityException}</li>
 *   <li>stop 이후 호출 → {@link com.ryuqq.aar.core.exception.ShutdownException}</li>
 *   <li>알 수 없는 Task ID 조회 → {@link com.ryuqq.aar.core.exception.TaskNotFoundException}</li>
 * </ul>
 *
 * @param <D> 분석 대상 데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AnalysisOrchestrator<D> extends AutoCloseable {

    /**
     * 도메인 엔진 등록.
     *
     * <p>이미 등록된 도메인이면 교체합니다. 교체는 이후 디스패치되는 Task에만 적용되며,
     * 이미 실행 중인 Task는 디스패치 시점의 엔진을 그대로 사용합니다.</p>
     *
     * @param domain 도메인
     * @param engine 분석 엔진
     * @throws IllegalArgumentException domain 또는 engine이 null인 경우
     */
    void registerEngine(AnalysisDomain domain, AnalysisEngine<D> engine);

    /**
     * 도메인 엔진 등록 해제.
     *
     * @param domain 도메인
     * @return 등록되어 있던 경우 true
     */
    boolean unregisterEngine(AnalysisDomain domain);

    /**
     * 등록된 도메인 목록.
     *
     * @return 불변 Set
     */
    Set<AnalysisDomain> getRegisteredDomains();

    /**
     * 디스패치 루프와 워커 풀 시작.
     *
     * @throws com.ryuqq.aar.core.exception.ShutdownException 이미 stop된 경우
     */
    void start();

    /**
     * 종료.
     *
     * <p>RUNNING/PENDING Task를 CANCELLED로 표시하고, 루프와 풀을 timeout 안에서 종료합니다.
     * 두 번째 호출부터는 아무 동작도 하지 않습니다.</p>
     *
     * @param timeout 최대 대기 시간
     */
    void stop(Duration timeout);

    /**
     * 실행 중 여부.
     *
     * @return start 이후 stop 이전이면 true
     */
    boolean isRunning();

    /**
     * 기본 timeout으로 stop.
     */
    @Override
    void close();

    /**
     * Task 제출.
     *
     * <p>큐에 넣고 즉시 반환합니다. start 이전에도 제출할 수 있으며, 이 경우 루프가
     * 시작될 때까지 대기합니다.</p>
     *
     * @param domain 도메인
     * @param data 분석 대상 데이터
     * @param config Task별 설정 (null이면 빈 Map)
     * @param priority 우선순위 (작을수록 먼저)
     * @param callback 완료 콜백 (null 가능)
     * @return 생성된 Task ID
     * @throws com.ryuqq.aar.core.exception.ConfigurationException 엔진 미등록
     * @throws com.ryuqq.aar.core.exception.CapacityException 활성 Task 한도 초과
     * @throws com.ryuqq.aar.core.exception.ShutdownException stop 이후
     */
    TaskId submitTask(AnalysisDomain domain, D data, Map<String, Object> config, int priority, TaskCallback callback);

    default TaskId submitTask(AnalysisDomain domain, D data, Map<String, Object> config,
                              TaskPriority priority, TaskCallback callback) {
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        return submitTask(domain, data, config, priority.value(), callback);
    }

    default TaskId submitTask(AnalysisDomain domain, D data, Map<String, Object> config, TaskPriority priority) {
        return submitTask(domain, data, config, priority, null);
    }

    default TaskId submitTask(AnalysisDomain domain, D data) {
        return submitTask(domain, data, Map.of(), TaskPriority.NORMAL, null);
    }

    /**
     * 여러 도메인에 같은 데이터로 Task 일괄 제출.
     *
     * <p>엔진이 없는 도메인은 오류 없이 건너뜁니다.</p>
     *
     * @param domains 도메인 목록
     * @param data 분석 대상 데이터
     * @param config Task별 설정
     * @param priority 우선순위
     * @return 실제로 스케줄된 Task ID 목록 (입력 순서)
     */
    List<TaskId> submitBatch(Collection<AnalysisDomain> domains, D data, Map<String, Object> config, int priority);

    default List<TaskId> submitBatch(Collection<AnalysisDomain> domains, D data,
                                     Map<String, Object> config, TaskPriority priority) {
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        return submitBatch(domains, data, config, priority.value());
    }

    /**
     * Task 취소.
     *
     * @param taskId Task ID
     * @return PENDING 또는 RUNNING이던 Task를 취소한 경우 true, 그 외(알 수 없는 ID 포함) false
     */
    boolean cancelTask(TaskId taskId);

    /**
     * Task 상태 조회.
     *
     * @param taskId Task ID
     * @return 현재 상태
     * @throws com.ryuqq.aar.core.exception.TaskNotFoundException 알 수 없는 ID
     */
    TaskStatus getTaskStatus(TaskId taskId);

    /**
     * Task 결과 스냅샷 조회.
     *
     * @param taskId Task ID
     * @return 종료 상태이면 스냅샷, 아니면 empty
     * @throws com.ryuqq.aar.core.exception.TaskNotFoundException 알 수 없는 ID
     */
    Optional<TaskResult> getTaskResult(TaskId taskId);

    /**
     * 도메인별 최신 완료 결과.
     *
     * @return 불변 Map
     */
    Map<AnalysisDomain, AnalysisResult> getAllResults();

    Optional<AnalysisResult> getDomainResult(AnalysisDomain domain);

    QueueStatus getQueueStatus();

    /**
     * 종료 상태 Task 기록 삭제.
     *
     * @return 삭제된 기록 수
     */
    int clearCompletedTasks();

    /**
     * 동기 일괄 분석.
     *
     * <p>HIGH 우선순위로 일괄 제출한 뒤 모든 Task가 종료되거나 timeout이 지날 때까지 대기합니다.
     * 완료된 결과만 반환하며, Task 실패로 예외를 던지지 않습니다.</p>
     *
     * @param data 분석 대상 데이터
     * @param domains 도메인 목록 (비어 있으면 등록된 전체 도메인)
     * @param config Task별 설정
     * @param timeout 최대 대기 시간
     * @return 완료된 도메인별 결과
     */
    Map<AnalysisDomain, AnalysisResult> analyzeAllDomains(D data, Collection<AnalysisDomain> domains,
                                                          Map<String, Object> config, Duration timeout);
}

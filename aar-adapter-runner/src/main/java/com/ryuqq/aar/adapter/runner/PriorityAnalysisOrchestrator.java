package com.ryuqq.aar.adapter.runner;

import com.ryuqq.aar.application.orchestrator.AnalysisOrchestrator;
import com.ryuqq.aar.application.orchestrator.QueueStatus;
import com.ryuqq.aar.application.orchestrator.TaskCallback;
import com.ryuqq.aar.core.engine.AnalysisEngine;
import com.ryuqq.aar.core.engine.AnalysisResult;
import com.ryuqq.aar.core.event.Event;
import com.ryuqq.aar.core.event.EventPayload;
import com.ryuqq.aar.core.event.EventType;
import com.ryuqq.aar.core.exception.CallbackException;
import com.ryuqq.aar.core.exception.CapacityException;
import com.ryuqq.aar.core.exception.ConfigurationException;
import com.ryuqq.aar.core.exception.EngineExecutionException;
import com.ryuqq.aar.core.exception.EventBusException;
import com.ryuqq.aar.core.exception.ShutdownException;
import com.ryuqq.aar.core.exception.TaskNotFoundException;
import com.ryuqq.aar.core.model.AnalysisDomain;
import com.ryuqq.aar.core.model.Task;
import com.ryuqq.aar.core.model.TaskId;
import com.ryuqq.aar.core.model.TaskPriority;
import com.ryuqq.aar.core.model.TaskResult;
import com.ryuqq.aar.core.spi.EventBus;
import com.ryuqq.aar.core.statemachine.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 우선순위 기반 분석 오케스트레이터.
 *
 * <p>도메인별 엔진을 등록받고, 제출된 Task를 (priority, sequence) 순서로
 * 고정 크기 워커 풀에서 실행합니다. 모든 생명주기 변화는 {@link EventBus}로 발행됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * submitTask()
 *   ↓ (lock) 엔진 확인 → 용량 확인 → 장부 등록 → 큐 삽입
 *   ↓ TASK_SUBMITTED 발행
 * 디스패처 (aar-dispatcher)
 *   ↓ (lock) PENDING → RUNNING, 엔진 캡처
 *   ↓ TASK_STARTED 발행
 * 워커 (aar-worker-N)
 *   ↓ engine.analyze() (lock 밖에서 실행)
 *   ↓ (lock) COMPLETED / FAILED 기록, active → completed
 *   ↓ TASK_COMPLETED / TASK_FAILED 발행
 *   ↓ callback (COMPLETED인 경우)
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>엔진 레지스트리, 장부, 지표는 모두 하나의 {@link ReentrantLock}으로 보호</li>
 *   <li>엔진 호출과 이벤트 발행은 lock 밖에서 수행</li>
 *   <li>RUNNING 중 취소된 Task는 CANCELLED를 유지하고, 늦게 도착한 결과는 버림</li>
 * </ul>
 *
 * <p><strong>이벤트 발행 실패:</strong> 버스 오류는 로그로만 남기고 Task 처리에 영향을 주지 않습니다.</p>
 *
 * @param <D> 분석 대상 데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PriorityAnalysisOrchestrator<D> implements AnalysisOrchestrator<D> {

    private static final Logger log = LoggerFactory.getLogger(PriorityAnalysisOrchestrator.class);

    static final String SOURCE = "orchestrator";

    private enum Lifecycle { NEW, RUNNING, STOPPED }

    private final EventBus eventBus;
    private final OrchestratorConfig config;
    private final PriorityTaskDispatcher<D> dispatcher;

    private final ReentrantLock lock = new ReentrantLock();
    private final EngineRegistry<D> engines = new EngineRegistry<>();
    private final TaskLedger<D> ledger = new TaskLedger<>();
    private final AtomicLong sequence = new AtomicLong();

    private Lifecycle lifecycle = Lifecycle.NEW;

    /**
     * 기본 설정으로 생성.
     *
     * @param eventBus 이벤트 버스
     */
    public PriorityAnalysisOrchestrator(EventBus eventBus) {
        this(eventBus, new OrchestratorConfig());
    }

    /**
     * 생성자.
     *
     * @param eventBus 이벤트 버스
     * @param config 오케스트레이터 설정
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public PriorityAnalysisOrchestrator(EventBus eventBus, OrchestratorConfig config) {
        if (eventBus == null) {
            throw new IllegalArgumentException("eventBus cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.eventBus = eventBus;
        this.config = config;
        this.dispatcher = new PriorityTaskDispatcher<>(
            new Target(), config.concurrency(), config.dispatchPollIntervalMs()
        );
    }

    // ========================================
    // 엔진 등록
    // ========================================

    @Override
    public void registerEngine(AnalysisDomain domain, AnalysisEngine<D> engine) {
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        AnalysisEngine<D> previous;
        lock.lock();
        try {
            previous = engines.register(domain, engine);
        } finally {
            lock.unlock();
        }
        if (previous != null) {
            log.info("Engine replaced: domain={}, engine={}", domain.getValue(), engine.name());
        } else {
            log.info("Engine registered: domain={}, engine={}", domain.getValue(), engine.name());
        }
        publish(EventType.ENGINE_REGISTERED, EventPayload.forDomain(domain).withAttribute("engine", engine.name()));
    }

    @Override
    public boolean unregisterEngine(AnalysisDomain domain) {
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        boolean removed;
        lock.lock();
        try {
            removed = engines.unregister(domain);
        } finally {
            lock.unlock();
        }
        if (removed) {
            log.info("Engine unregistered: domain={}", domain.getValue());
            publish(EventType.ENGINE_UNREGISTERED, EventPayload.forDomain(domain));
        }
        return removed;
    }

    @Override
    public Set<AnalysisDomain> getRegisteredDomains() {
        lock.lock();
        try {
            return engines.domains();
        } finally {
            lock.unlock();
        }
    }

    // ========================================
    // 생명주기
    // ========================================

    @Override
    public void start() {
        lock.lock();
        try {
            if (lifecycle == Lifecycle.STOPPED) {
                throw new ShutdownException("Orchestrator has been stopped and cannot be restarted");
            }
            if (lifecycle == Lifecycle.RUNNING) {
                return;
            }
            lifecycle = Lifecycle.RUNNING;
        } finally {
            lock.unlock();
        }
        dispatcher.start();
        log.info("Orchestrator started: concurrency={}, maxActiveTasks={}",
            config.concurrency(), config.maxActiveTasks());
        publish(EventType.ORCHESTRATOR_STARTED, EventPayload.empty()
            .withAttribute("concurrency", config.concurrency()));
    }

    @Override
    public void stop(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative");
        }
        Instant deadline = Instant.now().plus(timeout);

        lock.lock();
        try {
            if (lifecycle == Lifecycle.STOPPED) {
                return;
            }
            lifecycle = Lifecycle.STOPPED;
        } finally {
            lock.unlock();
        }

        dispatcher.stopLoop(remaining(deadline));

        List<TaskExecution<D>> cancelled = new ArrayList<>();
        lock.lock();
        try {
            Instant now = Instant.now();
            for (TaskExecution<D> execution : ledger.activeExecutions()) {
                execution.cancel(now);
                ledger.moveToCompleted(execution);
                cancelled.add(execution);
            }
            dispatcher.clearQueue();
        } finally {
            lock.unlock();
        }

        for (TaskExecution<D> execution : cancelled) {
            if (config.interruptOnCancel()) {
                interrupt(execution);
            }
            publish(EventType.TASK_CANCELLED, payloadOf(execution).withAttribute("reason", "shutdown"));
        }

        dispatcher.shutdownWorkers(remaining(deadline));

        log.info("Orchestrator stopped: cancelledTasks={}", cancelled.size());
        publish(EventType.ORCHESTRATOR_STOPPED, EventPayload.empty()
            .withAttribute("cancelledTasks", cancelled.size()));
    }

    @Override
    public boolean isRunning() {
        lock.lock();
        try {
            return lifecycle == Lifecycle.RUNNING;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        stop(Duration.ofMillis(config.defaultStopTimeoutMs()));
    }

    // ========================================
    // 제출
    // ========================================

    @Override
    public TaskId submitTask(AnalysisDomain domain, D data, Map<String, Object> taskConfig,
                             int priority, TaskCallback callback) {
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        Task<D> task;
        lock.lock();
        try {
            if (lifecycle == Lifecycle.STOPPED) {
                throw new ShutdownException("Orchestrator has been stopped");
            }
            if (!engines.contains(domain)) {
                throw new ConfigurationException("No engine registered for domain: " + domain.getValue());
            }
            if (ledger.activeCount() >= config.maxActiveTasks()) {
                throw new CapacityException(
                    "Active task limit reached (max: " + config.maxActiveTasks() + ")"
                );
            }
            task = Task.create(domain, data, taskConfig, priority, sequence.getAndIncrement());
            ledger.add(new TaskExecution<>(task, callback, task.getCreatedAt()));
            dispatcher.enqueue(task);
        } finally {
            lock.unlock();
        }

        log.debug("Task submitted: taskId={}, domain={}, priority={}",
            task.getTaskId().getValue(), domain.getValue(), priority);
        publish(EventType.TASK_SUBMITTED, EventPayload.forTask(task.getTaskId(), domain)
            .withAttribute("priority", priority));
        return task.getTaskId();
    }

    @Override
    public List<TaskId> submitBatch(Collection<AnalysisDomain> domains, D data,
                                    Map<String, Object> taskConfig, int priority) {
        if (domains == null) {
            throw new IllegalArgumentException("domains cannot be null");
        }
        List<TaskId> taskIds = new ArrayList<>();
        List<String> scheduled = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (AnalysisDomain domain : domains) {
            if (domain == null) {
                throw new IllegalArgumentException("domains cannot contain null");
            }
            if (!hasEngine(domain)) {
                log.warn("Skipping batch domain without engine: {}", domain.getValue());
                skipped.add(domain.getValue());
                continue;
            }
            try {
                taskIds.add(submitTask(domain, data, taskConfig, priority, null));
                scheduled.add(domain.getValue());
            } catch (ConfigurationException e) {
                log.warn("Skipping batch domain unregistered during submission: {}", domain.getValue());
                skipped.add(domain.getValue());
            }
        }

        publish(EventType.BATCH_SUBMITTED, EventPayload.empty()
            .withAttribute("scheduled", List.copyOf(scheduled))
            .withAttribute("skipped", List.copyOf(skipped))
            .withAttribute("taskIds", List.copyOf(taskIds)));
        return List.copyOf(taskIds);
    }

    // ========================================
    // 취소 / 조회
    // ========================================

    @Override
    public boolean cancelTask(TaskId taskId) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        TaskExecution<D> execution;
        TaskStatus previousStatus;
        lock.lock();
        try {
            execution = ledger.findActive(taskId);
            if (execution == null) {
                return false;
            }
            previousStatus = execution.status();
            execution.cancel(Instant.now());
            ledger.moveToCompleted(execution);
            dispatcher.remove(execution.task());
        } finally {
            lock.unlock();
        }

        if (previousStatus == TaskStatus.RUNNING && config.interruptOnCancel()) {
            interrupt(execution);
        }
        log.info("Task cancelled: taskId={}, previousStatus={}", taskId.getValue(), previousStatus);
        publish(EventType.TASK_CANCELLED, payloadOf(execution)
            .withAttribute("previousStatus", previousStatus.name()));
        return true;
    }

    @Override
    public TaskStatus getTaskStatus(TaskId taskId) {
        lock.lock();
        try {
            return require(taskId).status();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<TaskResult> getTaskResult(TaskId taskId) {
        lock.lock();
        try {
            TaskExecution<D> execution = require(taskId);
            if (!execution.status().isTerminal()) {
                return Optional.empty();
            }
            return Optional.of(execution.snapshot());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<AnalysisDomain, AnalysisResult> getAllResults() {
        lock.lock();
        try {
            return ledger.latestResults();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<AnalysisResult> getDomainResult(AnalysisDomain domain) {
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        lock.lock();
        try {
            return Optional.ofNullable(ledger.latestResult(domain));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public QueueStatus getQueueStatus() {
        lock.lock();
        try {
            return new QueueStatus(
                dispatcher.queuedCount(),
                ledger.countActive(TaskStatus.PENDING),
                ledger.countActive(TaskStatus.RUNNING),
                ledger.activeCount(),
                ledger.completedCount(),
                engines.size(),
                lifecycle == Lifecycle.RUNNING,
                ledger.totalTasks(),
                ledger.successfulTasks(),
                ledger.failedTasks(),
                ledger.cancelledTasks(),
                ledger.averageExecutionTime()
            );
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int clearCompletedTasks() {
        int cleared;
        lock.lock();
        try {
            cleared = ledger.clearCompleted();
        } finally {
            lock.unlock();
        }
        log.debug("Completed tasks cleared: {}", cleared);
        publish(EventType.COMPLETED_TASKS_CLEARED, EventPayload.empty().withAttribute("cleared", cleared));
        return cleared;
    }

    // ========================================
    // 동기 일괄 분석
    // ========================================

    @Override
    public Map<AnalysisDomain, AnalysisResult> analyzeAllDomains(D data, Collection<AnalysisDomain> domains,
                                                                 Map<String, Object> taskConfig, Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative");
        }
        Collection<AnalysisDomain> targets = domains == null || domains.isEmpty()
            ? getRegisteredDomains()
            : domains;

        List<TaskId> taskIds = submitBatch(targets, data, taskConfig, TaskPriority.HIGH);
        Instant deadline = Instant.now().plus(timeout);

        while (!allTerminal(taskIds)) {
            if (!Instant.now().isBefore(deadline)) {
                log.warn("analyzeAllDomains timed out after {}ms with unfinished tasks", timeout.toMillis());
                break;
            }
            sleep(config.completionPollIntervalMs());
        }

        Map<AnalysisDomain, AnalysisResult> results = new LinkedHashMap<>();
        List<TaskResult> failures = new ArrayList<>();
        lock.lock();
        try {
            for (TaskId taskId : taskIds) {
                TaskExecution<D> execution = ledger.find(taskId);
                if (execution == null) {
                    continue;
                }
                if (execution.status() == TaskStatus.COMPLETED) {
                    results.put(execution.task().getDomain(), execution.result());
                } else if (execution.status() == TaskStatus.FAILED) {
                    failures.add(execution.snapshot());
                }
            }
        } finally {
            lock.unlock();
        }

        for (TaskResult failure : failures) {
            publish(EventType.DOMAIN_ANALYSIS_FAILED, EventPayload.forTask(failure.taskId(), failure.domain())
                .withError(failure.error()));
        }
        return results;
    }

    // ========================================
    // 디스패치 / 실행 (디스패처, 워커 스레드)
    // ========================================

    private Runnable begin(Task<D> task) {
        TaskExecution<D> execution;
        AnalysisEngine<D> engine;
        boolean engineMissing = false;
        lock.lock();
        try {
            execution = ledger.findActive(task.getTaskId());
            if (execution == null || execution.status() != TaskStatus.PENDING) {
                return null;
            }
            Instant now = Instant.now();
            execution.markRunning(now);
            engine = engines.find(task.getDomain());
            if (engine == null) {
                execution.fail("No engine registered for domain: " + task.getDomain().getValue(), now);
                ledger.moveToCompleted(execution);
                engineMissing = true;
            }
        } finally {
            lock.unlock();
        }

        if (engineMissing) {
            log.warn("Engine unregistered before dispatch: taskId={}, domain={}",
                task.getTaskId().getValue(), task.getDomain().getValue());
            publish(EventType.TASK_FAILED, payloadOf(execution)
                .withError("No engine registered for domain: " + task.getDomain().getValue())
                .withAttribute("errorCode", ConfigurationException.ERROR_CODE));
            return null;
        }

        publish(EventType.TASK_STARTED, EventPayload.forTask(task.getTaskId(), task.getDomain())
            .withAttribute("engine", engine.name()));
        AnalysisEngine<D> captured = engine;
        return () -> execute(execution, captured);
    }

    private void execute(TaskExecution<D> execution, AnalysisEngine<D> engine) {
        Task<D> task = execution.task();
        AnalysisResult result = null;
        EngineExecutionException failure = null;
        try {
            result = engine.analyze(task.getData(), task.getConfig());
            if (result == null) {
                failure = new EngineExecutionException(task.getTaskId(), task.getDomain(),
                    new IllegalStateException("Engine returned no result"));
            }
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            failure = new EngineExecutionException(task.getTaskId(), task.getDomain(), e);
        }

        if (failure != null) {
            finishFailed(execution, failure);
        } else {
            finishCompleted(execution, result);
        }
    }

    private void finishCompleted(TaskExecution<D> execution, AnalysisResult result) {
        TaskId taskId = execution.task().getTaskId();
        Duration executionTime;
        lock.lock();
        try {
            if (execution.status() != TaskStatus.RUNNING) {
                log.debug("Discarding late result of task {} ({})", taskId.getValue(), execution.status());
                return;
            }
            execution.complete(result, Instant.now());
            ledger.moveToCompleted(execution);
            executionTime = execution.executionTime();
        } finally {
            lock.unlock();
        }

        long executionTimeMs = executionTime == null ? 0L : executionTime.toMillis();
        log.debug("Task completed: taskId={}, executionTimeMs={}", taskId.getValue(), executionTimeMs);
        publish(EventType.TASK_COMPLETED, payloadOf(execution)
            .withResult(result)
            .withAttribute("executionTimeMs", executionTimeMs));

        TaskCallback callback = execution.callback();
        if (callback != null) {
            invokeCallback(execution, callback, result);
        }
    }

    private void finishFailed(TaskExecution<D> execution, EngineExecutionException failure) {
        TaskId taskId = execution.task().getTaskId();
        lock.lock();
        try {
            if (execution.status() != TaskStatus.RUNNING) {
                log.debug("Discarding late failure of task {} ({})", taskId.getValue(), execution.status());
                return;
            }
            execution.fail(failure.getMessage(), Instant.now());
            ledger.moveToCompleted(execution);
        } finally {
            lock.unlock();
        }

        log.warn("Task failed: taskId={}, domain={}, error={}",
            taskId.getValue(), execution.task().getDomain().getValue(), failure.getMessage());
        publish(EventType.TASK_FAILED, payloadOf(execution)
            .withError(failure.getMessage())
            .withAttribute("errorCode", failure.getErrorCode()));
    }

    private void invokeCallback(TaskExecution<D> execution, TaskCallback callback, AnalysisResult result) {
        TaskId taskId = execution.task().getTaskId();
        try {
            callback.onComplete(taskId, result);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            CallbackException failure = new CallbackException(taskId, e);
            log.error("Callback failed: taskId={}", taskId.getValue(), failure);
            publish(EventType.CALLBACK_FAILED, payloadOf(execution)
                .withError(failure.getMessage())
                .withAttribute("errorCode", failure.getErrorCode()));
        }
    }

    // ========================================
    // 내부 헬퍼
    // ========================================

    private boolean hasEngine(AnalysisDomain domain) {
        lock.lock();
        try {
            return engines.contains(domain);
        } finally {
            lock.unlock();
        }
    }

    private boolean allTerminal(List<TaskId> taskIds) {
        lock.lock();
        try {
            for (TaskId taskId : taskIds) {
                TaskExecution<D> execution = ledger.find(taskId);
                if (execution != null && !execution.status().isTerminal()) {
                    return false;
                }
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    private TaskExecution<D> require(TaskId taskId) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        TaskExecution<D> execution = ledger.find(taskId);
        if (execution == null) {
            throw new TaskNotFoundException(taskId);
        }
        return execution;
    }

    private void interrupt(TaskExecution<D> execution) {
        Future<?> future;
        lock.lock();
        try {
            future = execution.future();
        } finally {
            lock.unlock();
        }
        if (future != null) {
            future.cancel(true);
        }
    }

    private static EventPayload payloadOf(TaskExecution<?> execution) {
        return EventPayload.forTask(execution.task().getTaskId(), execution.task().getDomain());
    }

    private void publish(EventType type, EventPayload payload) {
        try {
            eventBus.publish(Event.of(type, payload, SOURCE));
        } catch (EventBusException e) {
            log.warn("Event not published: type={}, reason={}", type.getValue(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Event publishing failed: type={}", type.getValue(), e);
        }
    }

    private static Duration remaining(Instant deadline) {
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Polling interrupted", e);
        }
    }

    /**
     * 디스패처 콜백 어댑터.
     */
    private final class Target implements DispatchTarget<D> {

        @Override
        public Runnable begin(Task<D> task) {
            return PriorityAnalysisOrchestrator.this.begin(task);
        }

        @Override
        public void attach(Task<D> task, Future<?> future) {
            boolean cancelledMeanwhile;
            lock.lock();
            try {
                TaskExecution<D> execution = ledger.find(task.getTaskId());
                if (execution == null) {
                    return;
                }
                execution.attach(future);
                cancelledMeanwhile = execution.status() == TaskStatus.CANCELLED;
            } finally {
                lock.unlock();
            }
            if (cancelledMeanwhile && config.interruptOnCancel()) {
                future.cancel(true);
            }
        }

        @Override
        public void onDispatchError(RuntimeException error) {
            publish(EventType.ORCHESTRATOR_ERROR, EventPayload.empty()
                .withError(String.valueOf(error.getMessage()))
                .withAttribute("errorType", error.getClass().getSimpleName()));
        }
    }
}

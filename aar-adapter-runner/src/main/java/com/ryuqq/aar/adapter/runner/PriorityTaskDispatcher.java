package com.ryuqq.aar.adapter.runner;

import com.ryuqq.aar.application.runtime.DispatchRuntime;
import com.ryuqq.aar.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 우선순위 Task 디스패처 ({@link DispatchRuntime} 구현체).
 *
 * <p>(priority, sequence) 순서의 우선순위 큐에서 Task를 꺼내 고정 크기 워커 풀로 넘깁니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * 1. 워커 permit 획득 (빈 워커가 생길 때까지 대기)
 * 2. queue.poll(dispatchPollIntervalMs)
 *    - 없음 → permit 반환, false
 * 3. target.begin(task) → PENDING → RUNNING (취소된 Task면 null → permit 반환)
 * 4. workers.submit(work) → 작업 종료 시 permit 반환
 * 5. target.attach(task, future)
 * </pre>
 *
 * <p><strong>우선순위 보장:</strong> permit을 먼저 얻고 Task를 꺼내므로,
 * 우선순위 비교는 워커가 실제로 비었을 때 이루어집니다. 워커가 모두 바쁜 동안
 * 더 급한 Task가 들어오면 그 Task가 먼저 나갑니다.</p>
 *
 * <p><strong>스레드 모델:</strong></p>
 * <ul>
 *   <li>디스패처 스레드 1개 ({@code aar-dispatcher}): pump() 반복 호출</li>
 *   <li>워커 스레드 concurrency개 ({@code aar-worker-N}): 엔진 실행</li>
 *   <li>모두 daemon 스레드이므로 포기된 워커가 JVM 종료를 막지 않음</li>
 * </ul>
 *
 * @param <D> 데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PriorityTaskDispatcher<D> implements DispatchRuntime {

    private static final Logger log = LoggerFactory.getLogger(PriorityTaskDispatcher.class);

    private final PriorityBlockingQueue<Task<D>> queue = new PriorityBlockingQueue<>();
    private final DispatchTarget<D> target;
    private final Semaphore permits;
    private final ExecutorService workers;
    private final long pollIntervalMs;

    private volatile boolean running;
    private Thread dispatcherThread;

    /**
     * 생성자.
     *
     * @param target Task 실행 대상
     * @param concurrency 워커 수
     * @param pollIntervalMs 큐 대기 간격 (밀리초)
     * @throws IllegalArgumentException 의존성이 null이거나 값이 양수가 아닌 경우
     */
    PriorityTaskDispatcher(DispatchTarget<D> target, int concurrency, long pollIntervalMs) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive (current: " + concurrency + ")");
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be positive (current: " + pollIntervalMs + ")");
        }
        this.target = target;
        this.permits = new Semaphore(concurrency);
        this.workers = Executors.newFixedThreadPool(concurrency, daemonThreads("aar-worker-"));
        this.pollIntervalMs = pollIntervalMs;
    }

    void enqueue(Task<D> task) {
        queue.offer(task);
    }

    boolean remove(Task<D> task) {
        return queue.remove(task);
    }

    int queuedCount() {
        return queue.size();
    }

    /**
     * 큐에 남은 Task 전부 제거.
     *
     * @return 제거된 Task 수
     */
    int clearQueue() {
        int cleared = queue.size();
        queue.clear();
        return cleared;
    }

    @Override
    public boolean pump() {
        acquirePermit();
        boolean handedOff = false;
        try {
            Task<D> task = pollTask();
            if (task == null) {
                return false;
            }

            Runnable work = target.begin(task);
            if (work == null) {
                log.debug("Skipping task {} (no longer pending)", task.getTaskId().getValue());
                return true;
            }

            Future<?> future = workers.submit(() -> {
                try {
                    work.run();
                } finally {
                    permits.release();
                }
            });
            handedOff = true;
            target.attach(task, future);
            return true;

        } catch (RejectedExecutionException e) {
            log.warn("Worker pool rejected task during shutdown", e);
            return false;
        } finally {
            if (!handedOff) {
                permits.release();
            }
        }
    }

    /**
     * 디스패처 스레드 시작.
     */
    synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        dispatcherThread = new Thread(this::loop, "aar-dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();
    }

    /**
     * 디스패처 스레드 중지 (인터럽트 후 join).
     *
     * @param timeout 최대 대기 시간
     * @return 스레드가 종료된 경우 true
     */
    synchronized boolean stopLoop(Duration timeout) {
        running = false;
        Thread thread = dispatcherThread;
        if (thread == null) {
            return true;
        }
        thread.interrupt();
        join(thread, timeout);
        if (thread.isAlive()) {
            log.warn("Dispatcher thread did not stop within {}ms", timeout.toMillis());
            return false;
        }
        return true;
    }

    /**
     * 워커 풀 종료.
     *
     * <p>진행 중인 작업은 timeout까지 기다리고, 그 뒤에는 인터럽트 후 포기합니다.</p>
     *
     * @param timeout 최대 대기 시간
     * @return 모든 워커가 종료된 경우 true
     */
    boolean shutdownWorkers(Duration timeout) {
        workers.shutdown();
        try {
            if (workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        workers.shutdownNow();
        log.warn("Worker pool did not terminate within {}ms, abandoning running workers", timeout.toMillis());
        return false;
    }

    boolean isRunning() {
        return running;
    }

    private void loop() {
        log.debug("Dispatcher loop started");
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                pump();
            } catch (RuntimeException e) {
                if (!running || Thread.currentThread().isInterrupted()) {
                    break;
                }
                log.error("Dispatch cycle failed", e);
                target.onDispatchError(e);
            }
        }
        log.debug("Dispatcher loop stopped");
    }

    private void acquirePermit() {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Dispatch interrupted while waiting for a worker", e);
        }
    }

    private Task<D> pollTask() {
        try {
            return queue.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Dispatch interrupted while waiting for a task", e);
        }
    }

    private static void join(Thread thread, Duration timeout) {
        try {
            thread.join(Math.max(1, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

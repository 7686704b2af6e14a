package com.ryuqq.aar.adapter.inmemory.bus;

import com.ryuqq.aar.core.event.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 전달 lane: 유한 FIFO 큐 1개와 워커 스레드 1개.
 *
 * <p>한 lane의 이벤트는 큐에 들어간 순서대로 하나씩 전달됩니다.
 * 같은 스레드가 발행한 이벤트는 항상 같은 lane으로 라우팅되므로
 * 발행자별 순서가 핸들러까지 유지됩니다.</p>
 *
 * <p><strong>종료 절차:</strong></p>
 * <ol>
 *   <li>{@link #requestDrain()} - 큐가 빌 때까지 계속 전달 후 종료</li>
 *   <li>{@link #awaitTermination(long)} - 제한 시간 동안 join</li>
 *   <li>{@link #abandon()} - 시간 초과 시 인터럽트하고 남은 이벤트 폐기</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class DispatchLane {

    private static final Logger log = LoggerFactory.getLogger(DispatchLane.class);
    private static final long POLL_INTERVAL_MS = 50;

    private final BlockingQueue<Event> queue;
    private final Consumer<Event> delivery;
    private final Thread worker;

    private volatile boolean draining;
    private volatile boolean abandoned;

    DispatchLane(String name, int capacity, Consumer<Event> delivery) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.delivery = delivery;
        this.worker = new Thread(this::run, name);
        this.worker.setDaemon(true);
    }

    void start() {
        worker.start();
    }

    /**
     * 큐 공간이 생길 때까지 최대 timeoutMs 대기하며 추가.
     *
     * @return 추가된 경우 true
     * @throws InterruptedException 대기 중 인터럽트
     */
    boolean offer(Event event, long timeoutMs) throws InterruptedException {
        return queue.offer(event, timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * 대기 없이 추가.
     *
     * @return 추가된 경우 true
     */
    boolean offerNow(Event event) {
        return queue.offer(event);
    }

    /**
     * 아직 전달되지 않은 이벤트를 큐에서 제거.
     *
     * @return 제거된 경우 true
     */
    boolean remove(Event event) {
        return queue.remove(event);
    }

    int size() {
        return queue.size();
    }

    void requestDrain() {
        draining = true;
    }

    /**
     * 워커 종료 대기.
     *
     * @param timeoutMs 최대 대기 시간 (0이면 대기하지 않음)
     * @return 워커가 종료된 경우 true
     * @throws InterruptedException 대기 중 인터럽트
     */
    boolean awaitTermination(long timeoutMs) throws InterruptedException {
        if (timeoutMs > 0) {
            worker.join(timeoutMs);
        }
        return !worker.isAlive();
    }

    /**
     * 워커를 포기하고 남은 이벤트를 폐기.
     *
     * @return 폐기된 이벤트 수
     */
    int abandon() {
        abandoned = true;
        worker.interrupt();
        return discardQueued();
    }

    /**
     * 큐에 남은 이벤트 폐기 (워커를 시작하지 않은 경우).
     *
     * @return 폐기된 이벤트 수
     */
    int discardQueued() {
        List<Event> remaining = new ArrayList<>();
        queue.drainTo(remaining);
        return remaining.size();
    }

    private void run() {
        while (!abandoned) {
            if (draining && queue.isEmpty()) {
                break;
            }
            Event event;
            try {
                event = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Lane {} interrupted, exiting", worker.getName());
                break;
            }
            if (event != null) {
                deliver(event);
            }
        }
        log.debug("Lane {} terminated", worker.getName());
    }

    private void deliver(Event event) {
        try {
            delivery.accept(event);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.error("Lane {} failed to deliver event {} ({})",
                worker.getName(), event.type().getValue(), event.eventId(), e);
        }
    }
}

package com.ryuqq.aar.adapter.runner;

import com.ryuqq.aar.core.model.AnalysisDomain;
import com.ryuqq.aar.core.model.Task;
import com.ryuqq.aar.core.model.TaskId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PriorityTaskDispatcher 유닛 테스트.
 *
 * <p>디스패치 한 사이클(pump)과 루프 생명주기를 검증합니다:</p>
 * <ul>
 *   <li>(priority, sequence) 순서로 꺼냄</li>
 *   <li>워커 permit을 먼저 얻고 Task를 꺼냄</li>
 *   <li>begin()이 null을 반환하면 permit 반환</li>
 *   <li>디스패치 오류는 루프를 멈추지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class PriorityTaskDispatcherTest {

    private static final AnalysisDomain DOMAIN = AnalysisDomain.of("ACTIVITY");

    private PriorityTaskDispatcher<String> dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.stopLoop(Duration.ofSeconds(1));
            dispatcher.shutdownWorkers(Duration.ofSeconds(1));
        }
    }

    // ============================================================
    // 1. 생성
    // ============================================================

    @Test
    void 잘못된_생성_파라미터_시_예외() {
        RecordingTarget target = new RecordingTarget();

        assertThatThrownBy(() -> new PriorityTaskDispatcher<String>(null, 1, 10))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("target");
        assertThatThrownBy(() -> new PriorityTaskDispatcher<>(target, 0, 10))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("concurrency");
        assertThatThrownBy(() -> new PriorityTaskDispatcher<>(target, 1, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pollIntervalMs");
    }

    // ============================================================
    // 2. pump()
    // ============================================================

    @Test
    void 큐가_비어_있으면_pump는_false() {
        // given
        dispatcher = new PriorityTaskDispatcher<>(new RecordingTarget(), 1, 10);

        // when
        boolean dispatched = dispatcher.pump();

        // then
        assertThat(dispatched).isFalse();
    }

    @Test
    void pump는_우선순위_그다음_순번_순서로_꺼냄() throws InterruptedException {
        // given
        RecordingTarget target = new RecordingTarget();
        dispatcher = new PriorityTaskDispatcher<>(target, 1, 10);
        dispatcher.enqueue(task("late-normal", 2, 2));
        dispatcher.enqueue(task("early-normal", 2, 0));
        dispatcher.enqueue(task("urgent", 1, 1));

        // when
        for (int i = 0; i < 3; i++) {
            assertThat(dispatcher.pump()).isTrue();
            target.awaitRuns(i + 1);
        }

        // then
        assertThat(target.begun).containsExactly("urgent", "early-normal", "late-normal");
        assertThat(dispatcher.queuedCount()).isZero();
    }

    @Test
    void begin이_null이면_permit_반환_후_다음_Task_디스패치() throws InterruptedException {
        // given
        RecordingTarget target = new RecordingTarget();
        target.skip.set(true);
        dispatcher = new PriorityTaskDispatcher<>(target, 1, 10);
        dispatcher.enqueue(task("skipped", 2, 0));
        dispatcher.enqueue(task("executed", 2, 1));

        // when
        assertThat(dispatcher.pump()).isTrue();
        target.skip.set(false);
        assertThat(dispatcher.pump()).isTrue();
        target.awaitRuns(1);

        // then
        assertThat(target.begun).containsExactly("skipped", "executed");
        assertThat(target.executed).containsExactly("executed");
    }

    @Test
    void 워커에_넘긴_작업의_Future를_attach() throws InterruptedException {
        // given
        RecordingTarget target = new RecordingTarget();
        dispatcher = new PriorityTaskDispatcher<>(target, 1, 10);
        dispatcher.enqueue(task("data", 2, 0));

        // when
        dispatcher.pump();
        target.awaitRuns(1);

        // then
        assertThat(target.attached).hasSize(1);
    }

    @Test
    void 워커가_바쁘면_permit을_기다린_뒤_그때의_최우선_Task를_꺼냄() throws InterruptedException {
        // given
        CountDownLatch gate = new CountDownLatch(1);
        RecordingTarget target = new RecordingTarget();
        target.gate = gate;
        dispatcher = new PriorityTaskDispatcher<>(target, 1, 10);
        dispatcher.enqueue(task("blocking", 2, 0));
        dispatcher.pump();

        // when: 워커가 바쁜 동안 낮은 우선순위 → 높은 우선순위 순서로 도착
        Thread pumper = new Thread(dispatcher::pump);
        pumper.start();
        dispatcher.enqueue(task("low", 3, 1));
        dispatcher.enqueue(task("high", 0, 2));
        gate.countDown();
        pumper.join(2000);

        // then
        assertThat(target.begun).containsExactly("blocking", "high");
        assertThat(dispatcher.queuedCount()).isEqualTo(1);
    }

    // ============================================================
    // 3. 큐 조작
    // ============================================================

    @Test
    void remove와_clearQueue로_대기_Task_제거() {
        // given
        dispatcher = new PriorityTaskDispatcher<>(new RecordingTarget(), 1, 10);
        Task<String> first = task("first", 2, 0);
        dispatcher.enqueue(first);
        dispatcher.enqueue(task("second", 2, 1));
        dispatcher.enqueue(task("third", 2, 2));

        // when
        boolean removed = dispatcher.remove(first);
        int cleared = dispatcher.clearQueue();

        // then
        assertThat(removed).isTrue();
        assertThat(cleared).isEqualTo(2);
        assertThat(dispatcher.queuedCount()).isZero();
    }

    // ============================================================
    // 4. 루프 생명주기
    // ============================================================

    @Test
    void 루프_시작_후_대기_Task_자동_디스패치_중지_시_종료() throws InterruptedException {
        // given
        RecordingTarget target = new RecordingTarget();
        dispatcher = new PriorityTaskDispatcher<>(target, 2, 10);
        dispatcher.enqueue(task("a", 2, 0));
        dispatcher.enqueue(task("b", 2, 1));

        // when
        dispatcher.start();
        target.awaitRuns(2);
        boolean loopStopped = dispatcher.stopLoop(Duration.ofSeconds(1));
        boolean workersStopped = dispatcher.shutdownWorkers(Duration.ofSeconds(1));

        // then
        assertThat(target.executed).containsExactlyInAnyOrder("a", "b");
        assertThat(loopStopped).isTrue();
        assertThat(workersStopped).isTrue();
        assertThat(dispatcher.isRunning()).isFalse();
    }

    @Test
    void 디스패치_오류가_나도_루프는_계속됨() throws InterruptedException {
        // given
        RecordingTarget target = new RecordingTarget();
        target.failNextBegin.set(true);
        dispatcher = new PriorityTaskDispatcher<>(target, 1, 10);
        dispatcher.enqueue(task("broken", 2, 0));
        dispatcher.enqueue(task("healthy", 2, 1));

        // when
        dispatcher.start();
        target.awaitRuns(1);

        // then
        assertThat(target.errors).hasSize(1);
        assertThat(target.executed).containsExactly("healthy");
    }

    @Test
    void 시작하지_않은_루프_중지는_즉시_true() {
        dispatcher = new PriorityTaskDispatcher<>(new RecordingTarget(), 1, 10);

        assertThat(dispatcher.stopLoop(Duration.ZERO)).isTrue();
    }

    // ============================================================
    // 헬퍼
    // ============================================================

    private static Task<String> task(String data, int priority, long sequence) {
        return Task.of(TaskId.generate(), DOMAIN, data, Map.of(), priority, sequence, Instant.now());
    }

    /**
     * begin/attach/onDispatchError 호출을 기록하는 DispatchTarget.
     */
    private static final class RecordingTarget implements DispatchTarget<String> {

        final List<String> begun = new CopyOnWriteArrayList<>();
        final List<String> executed = new CopyOnWriteArrayList<>();
        final List<Future<?>> attached = new CopyOnWriteArrayList<>();
        final List<RuntimeException> errors = new CopyOnWriteArrayList<>();
        final AtomicBoolean skip = new AtomicBoolean();
        final AtomicBoolean failNextBegin = new AtomicBoolean();
        volatile CountDownLatch gate;

        @Override
        public Runnable begin(Task<String> task) {
            if (failNextBegin.compareAndSet(true, false)) {
                throw new IllegalStateException("begin failed");
            }
            begun.add(task.getData());
            if (skip.get()) {
                return null;
            }
            CountDownLatch currentGate = gate;
            return () -> {
                if (currentGate != null) {
                    awaitGate(currentGate);
                }
                executed.add(task.getData());
            };
        }

        @Override
        public void attach(Task<String> task, Future<?> future) {
            attached.add(future);
        }

        @Override
        public void onDispatchError(RuntimeException error) {
            errors.add(error);
        }

        void awaitRuns(int count) throws InterruptedException {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (executed.size() < count) {
                if (System.nanoTime() > deadline) {
                    throw new AssertionError("Expected " + count + " runs but got " + executed.size());
                }
                Thread.sleep(5);
            }
        }

        private static void awaitGate(CountDownLatch gate) {
            try {
                gate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}

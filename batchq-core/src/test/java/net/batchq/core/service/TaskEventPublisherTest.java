package net.batchq.core.service;

import net.batchq.core.InMemoryTaskArchive;
import net.batchq.core.MutableClock;
import net.batchq.core.model.Batch;
import net.batchq.core.model.BatchCreated;
import net.batchq.core.model.Task;
import net.batchq.core.model.TaskEvent;
import net.batchq.core.model.TaskPriority;
import net.batchq.core.model.TaskResult;
import net.batchq.core.spi.TaskEventListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 상태 전이 이벤트 발행 + 아카이브 미러
 */
class TaskEventPublisherTest {

    MutableClock clock;
    InMemoryTaskArchive archive;
    InMemoryTaskArchive.CountingTx tx;
    List<TaskEvent> events;
    List<Batch> finished;
    TaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T09:00:00Z");
        archive = new InMemoryTaskArchive();
        tx = new InMemoryTaskArchive.CountingTx();
        events = new CopyOnWriteArrayList<>();
        finished = new CopyOnWriteArrayList<>();

        TaskEventListener recorder = new TaskEventListener() {
            @Override public void onTaskEvent(TaskEvent e) { events.add(e); }
            @Override public void onBatchFinished(Batch b) { finished.add(b); }
        };
        scheduler = new TaskScheduler(
                SchedulerConfig.defaults().withVisibilityTimeout(Duration.ofSeconds(10)),
                clock,
                TaskEventPublisher.direct(new TaskArchiveMirror(archive, tx), recorder));
    }

    @Test
    void every_transition_is_published_in_order() {
        String id = scheduler.enqueue("u1", "AAPL", Map.of(), TaskPriority.NORMAL).value();
        scheduler.dequeue("w1");
        clock.advance(Duration.ofSeconds(11));
        scheduler.recoverExpiredLeases();
        scheduler.dequeue("w2");
        scheduler.ackSuccess(id, TaskResult.of(Map.of("score", 3)));

        assertEquals(List.of(TaskEvent.Type.ENQUEUED, TaskEvent.Type.STARTED, TaskEvent.Type.REQUEUED,
                        TaskEvent.Type.STARTED, TaskEvent.Type.COMPLETED),
                events.stream().map(TaskEvent::type).toList());
        assertEquals(5, archive.saves().size());
        assertEquals(5, tx.calls.get());

        Task stored = archive.load(id).orElseThrow();
        assertEquals(Task.Status.COMPLETED, stored.status());
        assertEquals(1, stored.retryCount());
        assertEquals("w2", archive.saves().get(3).workerId());
    }

    @Test
    void batch_finish_is_published_once() {
        BatchCreated bc = scheduler.createBatch("u1", List.of("A", "B"), Map.of(), TaskPriority.NORMAL).value();
        scheduler.dequeue("w1");
        scheduler.dequeue("w2");
        scheduler.ackSuccess(bc.taskIds().get(0), null);
        assertTrue(finished.isEmpty());
        scheduler.ackFailure(bc.taskIds().get(1), "x");
        scheduler.ackFailure(bc.taskIds().get(1), "x");

        assertEquals(1, finished.size());
        assertEquals(Batch.Status.FAILED, finished.get(0).status());
    }

    @Test
    void archive_failure_does_not_affect_scheduling() {
        archive.failing(true);
        String id = scheduler.enqueue("u1", "AAPL", Map.of(), TaskPriority.NORMAL).value();
        assertEquals(id, scheduler.dequeue("w1").orElseThrow().id());
        assertTrue(scheduler.ackSuccess(id, null));

        assertEquals(Task.Status.COMPLETED, scheduler.getTask(id).orElseThrow().status());
        assertTrue(archive.saves().isEmpty());
        assertEquals(3, events.size(), "다른 리스너는 계속 받는다");
    }

    @Test
    void throwing_listener_is_isolated() {
        List<TaskEvent> seen = new CopyOnWriteArrayList<>();
        TaskEventListener broken = new TaskEventListener() {
            @Override public void onTaskEvent(TaskEvent e) { throw new IllegalStateException("boom"); }
        };
        TaskEventListener ok = new TaskEventListener() {
            @Override public void onTaskEvent(TaskEvent e) { seen.add(e); }
        };
        TaskScheduler s = new TaskScheduler(SchedulerConfig.defaults(), clock, TaskEventPublisher.direct(broken, ok));

        assertTrue(s.enqueue("u1", "A", Map.of(), TaskPriority.NORMAL).isSuccess());
        assertEquals(1, seen.size());
    }

    @Test
    void async_publisher_drains_on_close() {
        List<String> seen = new CopyOnWriteArrayList<>();
        TaskEventListener slow = new TaskEventListener() {
            @Override public void onTaskEvent(TaskEvent e) {
                try { Thread.sleep(20); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
                seen.add(Thread.currentThread().getName() + ":" + e.type());
            }
        };
        TaskEventPublisher pub = TaskEventPublisher.async(List.of(slow), "bq-events-test");
        TaskScheduler s = new TaskScheduler(SchedulerConfig.defaults(), clock, pub);

        String id = s.enqueue("u1", "A", Map.of(), TaskPriority.NORMAL).value();
        s.dequeue("w1");
        s.ackSuccess(id, null);
        pub.close();

        assertEquals(List.of("bq-events-test:ENQUEUED", "bq-events-test:STARTED", "bq-events-test:COMPLETED"), seen);
    }

    @Test
    void transitions_from_racing_threads_are_delivered_in_commit_order() throws Exception {
        List<String> seen = new CopyOnWriteArrayList<>();
        TaskEventListener recorder = new TaskEventListener() {
            @Override public void onTaskEvent(TaskEvent e) { seen.add(e.type() + ":" + e.task().status()); }
        };
        InMemoryTaskArchive store = new InMemoryTaskArchive();
        HoldingExecutor gate = new HoldingExecutor();
        TaskScheduler s = new TaskScheduler(SchedulerConfig.defaults(), clock,
                new TaskEventPublisher(List.of(new TaskArchiveMirror(store, InMemoryTaskArchive.NO_TX), recorder), gate));

        String id = s.enqueue("u1", "AAPL", Map.of(), TaskPriority.NORMAL).value();

        // 워커: dequeue 는 확정됐지만 전달 직전에 멈춘다
        Thread worker = new Thread(() -> s.dequeue("w1"), "worker-1");
        gate.holdOnce(worker);
        worker.start();
        assertTrue(gate.entered.await(5, TimeUnit.SECONDS));

        // 그 사이 다른 스레드가 같은 태스크를 취소
        Thread canceller = new Thread(() -> s.cancel(id), "canceller");
        canceller.start();
        await().atMost(Duration.ofSeconds(5))
                .until(() -> s.getTask(id).orElseThrow().status() == Task.Status.CANCELLED);

        gate.release.countDown();
        worker.join(5_000);
        canceller.join(5_000);

        assertEquals(List.of("ENQUEUED:QUEUED", "STARTED:PROCESSING", "CANCELLED:CANCELLED"), seen);
        assertEquals(Task.Status.CANCELLED, store.load(id).orElseThrow().status(), "아카이브도 최종 상태");
    }

    @Test
    void async_backlog_is_bounded() throws Exception {
        CountDownLatch busy = new CountDownLatch(1);
        CountDownLatch unblock = new CountDownLatch(1);
        List<TaskEvent> seen = new CopyOnWriteArrayList<>();
        TaskEventListener slow = new TaskEventListener() {
            @Override public void onTaskEvent(TaskEvent e) {
                busy.countDown();
                try { unblock.await(5, TimeUnit.SECONDS); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
                seen.add(e);
            }
        };
        TaskEventPublisher pub = TaskEventPublisher.async(List.of(slow), "bq-events-bounded", 1);
        TaskScheduler s = new TaskScheduler(SchedulerConfig.defaults(), clock, pub);

        s.enqueue("u1", "A", Map.of(), TaskPriority.NORMAL);
        assertTrue(busy.await(5, TimeUnit.SECONDS), "첫 전달이 스레드를 점유");
        s.enqueue("u1", "B", Map.of(), TaskPriority.NORMAL);      // 대기열 1칸
        String c = s.enqueue("u1", "C", Map.of(), TaskPriority.NORMAL).value(); // 넘침: 버리고 error 로그
        assertEquals(1, pub.backlog());

        unblock.countDown();
        pub.close();

        assertEquals(List.of("A", "B"), seen.stream().map(e -> e.task().symbol()).toList());
        assertEquals(Task.Status.QUEUED, s.getTask(c).orElseThrow().status(), "전달이 밀려도 스케줄링은 그대로");
    }

    /** 지정한 스레드의 첫 execute 를 release 될 때까지 붙잡는다 (unlock 과 전달 사이 선점 재현) */
    static final class HoldingExecutor implements Executor {
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        private volatile Thread held;

        void holdOnce(Thread t) {
            held = t;
        }

        @Override
        public void execute(Runnable r) {
            if (Thread.currentThread() == held) {
                held = null;
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }
            r.run();
        }
    }
}

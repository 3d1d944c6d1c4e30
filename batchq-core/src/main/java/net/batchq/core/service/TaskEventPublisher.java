package net.batchq.core.service;

import net.batchq.core.model.Batch;
import net.batchq.core.model.TaskEvent;
import net.batchq.core.spi.TaskEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 상태 전이를 리스너에게 넘긴다.
 * 스케줄러는 락을 쥔 채 stage() 로 전이를 FIFO 에 쌓고, 락을 푼 뒤 drain() 으로 흘려보낸다.
 * 쌓인 순서(= 전이가 확정된 순서) 그대로 executor 에 넘기므로 executor 는 직렬이어야 한다
 * (direct 또는 단일 스레드).
 * 리스너 예외는 로그만 남기고 다음 리스너로 진행.
 */
public final class TaskEventPublisher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskEventPublisher.class);

    /** async() 기본 대기열 크기 */
    public static final int DEFAULT_BACKLOG_CAPACITY = 10_000;

    private final List<TaskEventListener> listeners;
    private final Executor executor;
    private final ExecutorService owned;   // async() 로 만든 경우에만

    private final Queue<Staged> staged = new ConcurrentLinkedQueue<>();
    private final ReentrantLock drainLock = new ReentrantLock();

    private record Staged(List<TaskEvent> events, List<Batch> finishedBatches) {}

    public TaskEventPublisher(List<TaskEventListener> listeners, Executor executor) {
        this(listeners, executor, null);
    }

    private TaskEventPublisher(List<TaskEventListener> listeners, Executor executor, ExecutorService owned) {
        this.listeners = List.copyOf(listeners);
        this.executor = executor;
        this.owned = owned;
    }

    public static TaskEventPublisher none() {
        return new TaskEventPublisher(List.of(), Runnable::run);
    }

    /** 호출 스레드에서 바로 전달 (테스트/단순 구성용) */
    public static TaskEventPublisher direct(TaskEventListener... listeners) {
        return new TaskEventPublisher(List.of(listeners), Runnable::run);
    }

    public static TaskEventPublisher async(List<TaskEventListener> listeners, String threadName) {
        return async(listeners, threadName, DEFAULT_BACKLOG_CAPACITY);
    }

    /**
     * 전용 데몬 스레드 하나로 전달. 대기 중인 전달이 backlogCapacity 를 넘으면 버리고 error 로그.
     * close() 때 남은 이벤트를 마저 흘려보내고 종료
     */
    public static TaskEventPublisher async(List<TaskEventListener> listeners, String threadName, int backlogCapacity) {
        if (backlogCapacity <= 0) throw new IllegalArgumentException("backlogCapacity must be > 0: " + backlogCapacity);
        ThreadPoolExecutor es = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(backlogCapacity), r -> {
                    Thread t = new Thread(r, threadName);
                    t.setDaemon(true);
                    return t;
                });
        return new TaskEventPublisher(listeners, es, es);
    }

    public boolean hasListeners() {
        return !listeners.isEmpty();
    }

    /** 스케줄러 락 안에서 호출: 전이가 확정된 순서대로 쌓는다 */
    void stage(List<TaskEvent> events, List<Batch> finishedBatches) {
        if (listeners.isEmpty() || (events.isEmpty() && finishedBatches.isEmpty())) return;
        staged.add(new Staged(List.copyOf(events), List.copyOf(finishedBatches)));
    }

    /** 스케줄러 락 밖에서 호출: 쌓인 전이를 순서대로 executor 에 넘긴다 */
    void drain() {
        if (staged.isEmpty()) return;
        drainLock.lock();
        try {
            Staged next;
            while ((next = staged.poll()) != null) {
                Staged unit = next;
                try {
                    executor.execute(() -> deliver(unit.events(), unit.finishedBatches()));
                } catch (RejectedExecutionException e) {
                    log.error("event delivery rejected, dropped {} task events and {} batch events",
                            unit.events().size(), unit.finishedBatches().size(), e);
                }
            }
        } finally {
            drainLock.unlock();
        }
    }

    /** 아직 executor 에 넘기지 못했거나 전달을 기다리는 묶음 수 */
    public int backlog() {
        int pending = staged.size();
        if (owned instanceof ThreadPoolExecutor) pending += ((ThreadPoolExecutor) owned).getQueue().size();
        return pending;
    }

    private void deliver(List<TaskEvent> events, List<Batch> finishedBatches) {
        for (TaskEvent e : events) {
            for (TaskEventListener l : listeners) {
                try {
                    l.onTaskEvent(e);
                } catch (RuntimeException ex) {
                    log.error("listener {} failed on {} of task {}", l.getClass().getSimpleName(), e.type(), e.task().id(), ex);
                }
            }
        }
        for (Batch b : finishedBatches) {
            for (TaskEventListener l : listeners) {
                try {
                    l.onBatchFinished(b);
                } catch (RuntimeException ex) {
                    log.error("listener {} failed on batch {} ({})", l.getClass().getSimpleName(), b.id(), b.status(), ex);
                }
            }
        }
    }

    @Override
    public void close() {
        if (owned == null) return;
        owned.shutdown();
        try {
            if (!owned.awaitTermination(5, TimeUnit.SECONDS)) {
                List<Runnable> dropped = owned.shutdownNow();
                log.warn("event executor did not drain in time, dropped {} pending deliveries", dropped.size());
            }
        } catch (InterruptedException e) {
            owned.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

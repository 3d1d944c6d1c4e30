package net.batchq.core.worker;

import net.batchq.core.model.Task;
import net.batchq.core.model.TaskResult;
import net.batchq.core.service.TaskScheduler;
import net.batchq.core.spi.AnalysisEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 프로세스 내 폴링 워커.
 * 스레드마다 워커로 등록하고 dequeue → engine.analyze → ack 를 반복한다.
 * 큐가 비었거나 입장 상한에 걸리면 pollInterval 만큼 쉰다.
 */
public final class TaskWorkerPool {
    private static final Logger log = LoggerFactory.getLogger(TaskWorkerPool.class);

    private final TaskScheduler scheduler;
    private final AnalysisEngine engine;
    private final String workerType;
    private final int threads;
    private final Duration pollInterval;
    private final String namePrefix;

    private volatile boolean running = false;
    private ExecutorService executor;
    private final List<String> workerIds = new ArrayList<>();

    public TaskWorkerPool(TaskScheduler scheduler, AnalysisEngine engine, String workerType,
                          int threads, Duration pollInterval) {
        if (threads <= 0) throw new IllegalArgumentException("threads must be > 0: " + threads);
        this.scheduler = scheduler;
        this.engine = engine;
        this.workerType = workerType == null ? "analysis" : workerType;
        this.threads = threads;
        this.pollInterval = pollInterval == null ? Duration.ofSeconds(1) : pollInterval;
        this.namePrefix = this.workerType + "-" + Long.toHexString(System.nanoTime() & 0xffffff);
    }

    public synchronized void start() {
        if (running) {
            log.warn("worker pool {} is already running", namePrefix);
            return;
        }
        running = true;
        executor = Executors.newFixedThreadPool(threads, threadFactory());
        for (int i = 0; i < threads; i++) {
            String workerId = namePrefix + "-" + i;
            scheduler.registerWorker(workerId, workerType);
            workerIds.add(workerId);
            executor.submit(() -> workerLoop(workerId));
        }
        log.info("worker pool {} started with {} threads", namePrefix, threads);
    }

    public synchronized void stop() {
        if (!running) return;
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (String id : workerIds) {
            scheduler.unregisterWorker(id);
        }
        workerIds.clear();
        log.info("worker pool {} stopped", namePrefix);
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized List<String> workerIds() {
        return List.copyOf(workerIds);
    }

    private void workerLoop(String workerId) {
        log.debug("worker {} loop started", workerId);
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                scheduler.heartbeat(workerId, null);
                Optional<Task> next = scheduler.dequeue(workerId);
                if (next.isEmpty()) {
                    Thread.sleep(pollInterval.toMillis());
                    continue;
                }
                process(workerId, next.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("worker {} loop error: {}", workerId, e.getMessage(), e);
                if (!pause()) break;
            }
        }
        log.debug("worker {} loop stopped", workerId);
    }

    private void process(String workerId, Task task) {
        scheduler.heartbeat(workerId, task.id());
        long began = System.nanoTime();
        try {
            TaskResult r = engine.analyze(task);
            long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - began);
            TaskResult withDuration = r == null
                    ? new TaskResult(null, null, tookMs)
                    : new TaskResult(r.data(), r.message(), r.durationMs() == null ? tookMs : r.durationMs());
            if (!scheduler.ack(task.id(), workerId, true, withDuration, null)) {
                log.warn("worker {} result for task {} was not accepted (cancelled or requeued)", workerId, task.id());
            }
        } catch (Exception e) {
            if (e instanceof InterruptedException) Thread.currentThread().interrupt();
            String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.warn("worker {} task {} ({}) failed: {}", workerId, task.id(), task.symbol(), msg);
            scheduler.ack(task.id(), workerId, false, null, msg);
        }
    }

    private boolean pause() {
        try {
            Thread.sleep(pollInterval.toMillis());
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private ThreadFactory threadFactory() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, namePrefix + "-thread-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}

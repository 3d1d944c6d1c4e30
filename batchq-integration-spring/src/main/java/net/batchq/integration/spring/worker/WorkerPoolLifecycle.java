package net.batchq.integration.spring.worker;

import net.batchq.core.worker.TaskWorkerPool;
import org.springframework.context.SmartLifecycle;

/** 컨텍스트 시작/종료에 맞춰 워커 풀을 올리고 내린다 */
public class WorkerPoolLifecycle implements SmartLifecycle {
    private final TaskWorkerPool pool;

    public WorkerPoolLifecycle(TaskWorkerPool pool) {
        this.pool = pool;
    }

    @Override public void start() { pool.start(); }

    @Override public void stop() { pool.stop(); }

    @Override public boolean isRunning() { return pool.isRunning(); }

    public TaskWorkerPool pool() { return pool; }
}

package net.batchq.core.maintenance;

import net.batchq.core.model.WorkerInfo;
import net.batchq.core.service.TaskScheduler;
import net.batchq.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public final class MaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration workerHeartbeatTimeout;

    public static final Duration DEFAULT_WORKER_HEARTBEAT_TIMEOUT = Duration.ofSeconds(120);

    public MaintenanceService(TaskScheduler scheduler, Clock clock, Duration workerHeartbeatTimeout) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.workerHeartbeatTimeout = workerHeartbeatTimeout == null ? DEFAULT_WORKER_HEARTBEAT_TIMEOUT : workerHeartbeatTimeout;
    }

    /**
     * 주기 점검 메인 루틴.
     * - 만료 lease 회수 (재큐잉 또는 FAILED)
     * - heartbeat 끊긴 워커 제거
     * - 워커 누수(들고 있지 않은 태스크를 current 로 표시) 탐지
     * - 오래된 종료 태스크 정리
     */
    public MaintenanceReport runOnce() {
        MaintenanceReport r = new MaintenanceReport();
        r.timestamp = clock.now();

        // 1) lease 만료 복구
        TaskScheduler.SweepResult sweep = scheduler.recoverExpiredLeases();
        r.requeuedTasks = sweep.requeued().size();
        r.failedTasks = sweep.failed().size();

        // 2) 좀비 워커 제거
        r.removedWorkers = scheduler.removeStaleWorkers(workerHeartbeatTimeout).size();

        // 3) 누수 탐지 (보고만)
        List<WorkerInfo> leaks = scheduler.findWorkerLeaks();
        for (WorkerInfo w : leaks) {
            log.warn("worker {} reports task {} it does not hold", w.id(), w.currentTaskId());
        }
        r.leakedWorkers = leaks.size();

        // 4) 오래된 종료 태스크 정리
        r.purgedTasks = scheduler.cleanupOldTasks();

        if (r.hasWork()) {
            log.info("maintenance: {}", r);
        }
        return r;
    }

    /** 간단 리포트 DTO */
    public static final class MaintenanceReport {
        public Instant timestamp;
        public int requeuedTasks;
        public int failedTasks;
        public int removedWorkers;
        public int leakedWorkers;
        public int purgedTasks;

        public boolean hasWork() {
            return requeuedTasks + failedTasks + removedWorkers + leakedWorkers + purgedTasks > 0;
        }

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", requeuedTasks=" + requeuedTasks +
                    ", failedTasks=" + failedTasks +
                    ", removedWorkers=" + removedWorkers +
                    ", leakedWorkers=" + leakedWorkers +
                    ", purgedTasks=" + purgedTasks +
                    '}';
        }
    }
}

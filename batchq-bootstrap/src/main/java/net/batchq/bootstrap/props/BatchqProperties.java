package net.batchq.bootstrap.props;

import net.batchq.core.maintenance.MaintenanceService;
import net.batchq.core.service.RetryPolicy;
import net.batchq.core.service.SchedulerConfig;
import net.batchq.core.service.TaskEventPublisher;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties("batchq")
public class BatchqProperties {
    private Queue queue = new Queue();
    private Scheduler scheduler = new Scheduler();
    private Persistence persistence = new Persistence();
    private Worker worker = new Worker();
    private Events events = new Events();

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Events getEvents() {
        return events;
    }

    public void setEvents(Events events) {
        this.events = events;
    }

    /** 큐 한도 → 코어 SchedulerConfig (검증은 SchedulerConfig 쪽에서) */
    public SchedulerConfig toSchedulerConfig() {
        RetryPolicy retry = queue.getMaxRetries() == null
                ? RetryPolicy.unbounded()
                : RetryPolicy.maxRequeues(queue.getMaxRetries());
        return new SchedulerConfig(
                queue.getUserConcurrentLimit(),
                queue.getGlobalConcurrentLimit(),
                Duration.ofSeconds(queue.getVisibilityTimeoutSeconds()),
                Duration.ofDays(queue.getTaskCleanupAgeDays()),
                queue.getMaxBatchSize(),
                queue.getMaxQueueSize(),
                retry);
    }

    public static class Queue {
        private int userConcurrentLimit = SchedulerConfig.DEFAULT_USER_CONCURRENT_LIMIT;
        private int globalConcurrentLimit = SchedulerConfig.DEFAULT_GLOBAL_CONCURRENT_LIMIT;
        private long visibilityTimeoutSeconds = SchedulerConfig.DEFAULT_VISIBILITY_TIMEOUT.toSeconds();
        private long taskCleanupAgeDays = SchedulerConfig.DEFAULT_TASK_CLEANUP_AGE.toDays();
        private int maxBatchSize = SchedulerConfig.DEFAULT_MAX_BATCH_SIZE;
        private int maxQueueSize = SchedulerConfig.DEFAULT_MAX_QUEUE_SIZE;
        private Integer maxRetries; // null = 무제한

        public int getUserConcurrentLimit() {
            return userConcurrentLimit;
        }

        public void setUserConcurrentLimit(int userConcurrentLimit) {
            this.userConcurrentLimit = userConcurrentLimit;
        }

        public int getGlobalConcurrentLimit() {
            return globalConcurrentLimit;
        }

        public void setGlobalConcurrentLimit(int globalConcurrentLimit) {
            this.globalConcurrentLimit = globalConcurrentLimit;
        }

        public long getVisibilityTimeoutSeconds() {
            return visibilityTimeoutSeconds;
        }

        public void setVisibilityTimeoutSeconds(long visibilityTimeoutSeconds) {
            this.visibilityTimeoutSeconds = visibilityTimeoutSeconds;
        }

        public long getTaskCleanupAgeDays() {
            return taskCleanupAgeDays;
        }

        public void setTaskCleanupAgeDays(long taskCleanupAgeDays) {
            this.taskCleanupAgeDays = taskCleanupAgeDays;
        }

        public int getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }

        public int getMaxQueueSize() {
            return maxQueueSize;
        }

        public void setMaxQueueSize(int maxQueueSize) {
            this.maxQueueSize = maxQueueSize;
        }

        public Integer getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        // 실제 @Scheduled 주기는 같은 키를 placeholder 로 읽는다 (여기는 바인딩/문서용)
        private long sweepDelayMs = 5000;
        private long maintenanceDelayMs = 60000;
        private Duration workerHeartbeatTimeout = MaintenanceService.DEFAULT_WORKER_HEARTBEAT_TIMEOUT;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getSweepDelayMs() {
            return sweepDelayMs;
        }

        public void setSweepDelayMs(long sweepDelayMs) {
            this.sweepDelayMs = sweepDelayMs;
        }

        public long getMaintenanceDelayMs() {
            return maintenanceDelayMs;
        }

        public void setMaintenanceDelayMs(long maintenanceDelayMs) {
            this.maintenanceDelayMs = maintenanceDelayMs;
        }

        public Duration getWorkerHeartbeatTimeout() {
            return workerHeartbeatTimeout;
        }

        public void setWorkerHeartbeatTimeout(Duration workerHeartbeatTimeout) {
            this.workerHeartbeatTimeout = workerHeartbeatTimeout;
        }
    }

    public static class Persistence {
        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Worker {
        private boolean enabled = false;
        private int threads = 2;
        private String type = "analysis";
        private Duration pollInterval = Duration.ofSeconds(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }
    }

    public static class Events {
        private int backlogCapacity = TaskEventPublisher.DEFAULT_BACKLOG_CAPACITY;

        public int getBacklogCapacity() {
            return backlogCapacity;
        }

        public void setBacklogCapacity(int backlogCapacity) {
            this.backlogCapacity = backlogCapacity;
        }
    }
}

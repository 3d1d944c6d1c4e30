package net.batchq.core.service;

import java.time.Duration;
import java.util.Objects;

public record SchedulerConfig(
        int userConcurrentLimit,
        int globalConcurrentLimit,
        Duration visibilityTimeout,
        Duration taskCleanupAge,
        int maxBatchSize,
        int maxQueueSize,
        RetryPolicy retryPolicy
) {
    public static final int DEFAULT_USER_CONCURRENT_LIMIT = 5;
    public static final int DEFAULT_GLOBAL_CONCURRENT_LIMIT = 50;
    public static final Duration DEFAULT_VISIBILITY_TIMEOUT = Duration.ofSeconds(300);
    public static final Duration DEFAULT_TASK_CLEANUP_AGE = Duration.ofDays(7);
    public static final int DEFAULT_MAX_BATCH_SIZE = 1000;
    public static final int DEFAULT_MAX_QUEUE_SIZE = 10_000;

    public SchedulerConfig {
        if (userConcurrentLimit <= 0) throw new IllegalArgumentException("userConcurrentLimit must be > 0");
        if (globalConcurrentLimit <= 0) throw new IllegalArgumentException("globalConcurrentLimit must be > 0");
        Objects.requireNonNull(visibilityTimeout, "visibilityTimeout");
        if (visibilityTimeout.isZero() || visibilityTimeout.isNegative()) {
            throw new IllegalArgumentException("visibilityTimeout must be positive");
        }
        Objects.requireNonNull(taskCleanupAge, "taskCleanupAge");
        if (maxBatchSize <= 0) throw new IllegalArgumentException("maxBatchSize must be > 0");
        if (maxQueueSize <= 0) throw new IllegalArgumentException("maxQueueSize must be > 0");
        retryPolicy = retryPolicy == null ? RetryPolicy.unbounded() : retryPolicy;
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(DEFAULT_USER_CONCURRENT_LIMIT, DEFAULT_GLOBAL_CONCURRENT_LIMIT,
                DEFAULT_VISIBILITY_TIMEOUT, DEFAULT_TASK_CLEANUP_AGE,
                DEFAULT_MAX_BATCH_SIZE, DEFAULT_MAX_QUEUE_SIZE, RetryPolicy.unbounded());
    }

    public SchedulerConfig withLimits(int user, int global) {
        return new SchedulerConfig(user, global, visibilityTimeout, taskCleanupAge, maxBatchSize, maxQueueSize, retryPolicy);
    }

    public SchedulerConfig withVisibilityTimeout(Duration d) {
        return new SchedulerConfig(userConcurrentLimit, globalConcurrentLimit, d, taskCleanupAge, maxBatchSize, maxQueueSize, retryPolicy);
    }

    public SchedulerConfig withTaskCleanupAge(Duration d) {
        return new SchedulerConfig(userConcurrentLimit, globalConcurrentLimit, visibilityTimeout, d, maxBatchSize, maxQueueSize, retryPolicy);
    }

    public SchedulerConfig withMaxBatchSize(int n) {
        return new SchedulerConfig(userConcurrentLimit, globalConcurrentLimit, visibilityTimeout, taskCleanupAge, n, maxQueueSize, retryPolicy);
    }

    public SchedulerConfig withMaxQueueSize(int n) {
        return new SchedulerConfig(userConcurrentLimit, globalConcurrentLimit, visibilityTimeout, taskCleanupAge, maxBatchSize, n, retryPolicy);
    }

    public SchedulerConfig withRetryPolicy(RetryPolicy p) {
        return new SchedulerConfig(userConcurrentLimit, globalConcurrentLimit, visibilityTimeout, taskCleanupAge, maxBatchSize, maxQueueSize, p);
    }
}

package net.batchq.core.model;

public record QueueStats(
        int queued,
        int processing,
        int completed,
        int failed,
        int cancelled,
        int total
) {}

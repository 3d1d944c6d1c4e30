package net.batchq.core.model;

public record UserQueueStatus(
        String userId,
        int processing,
        int concurrentLimit,
        int availableSlots
) {}

package net.batchq.core.model;

public record BatchQueueStats(
        QueueStats tasks,
        int activeBatches,      // PROCESSING
        int completedBatches,   // COMPLETED + FAILED
        int pendingBatches      // PENDING
) {}

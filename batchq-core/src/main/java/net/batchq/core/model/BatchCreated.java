package net.batchq.core.model;

import java.util.List;

public record BatchCreated(
        String batchId,
        List<String> taskIds,
        long estimatedDurationSeconds
) {
    public BatchCreated {
        taskIds = List.copyOf(taskIds);
    }

    public int taskCount() {
        return taskIds.size();
    }
}

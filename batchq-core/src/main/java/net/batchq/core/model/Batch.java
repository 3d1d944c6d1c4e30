package net.batchq.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record Batch(
        String id,
        String userId,
        String name,
        List<String> taskIds,             // 생성 시점에 고정 (순서 유지)
        int totalTasks,
        int completedTasks,
        int failedTasks,
        Status status,
        Map<String, Object> parameters,
        Instant createdAt,
        Instant startedAt,                // 첫 멤버가 dequeue 된 시각
        Instant finishedAt
) {
    public enum Status {
        PENDING, PROCESSING, COMPLETED, FAILED, CANCELLED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }

        public boolean terminal() {
            return this == COMPLETED || this == FAILED || this == CANCELLED;
        }
    }

    public Batch {
        taskIds = List.copyOf(taskIds);
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        if (completedTasks + failedTasks > totalTasks) {
            throw new IllegalStateException("batch " + id + " counters exceed total: "
                    + completedTasks + "+" + failedTasks + " > " + totalTasks);
        }
    }

    public static Batch pending(String id, String userId, String name, List<String> taskIds,
                                Map<String, Object> parameters, Instant now) {
        return new Batch(id, userId, name, taskIds, taskIds.size(), 0, 0, Status.PENDING, parameters,
                now, null, null);
    }

    /** (completed + failed) / total 의 반올림 백분율 */
    public int progress() {
        if (totalTasks == 0) return 100;
        return (int) Math.round((completedTasks + failedTasks) * 100.0 / totalTasks);
    }

    public boolean terminal() {
        return status.terminal();
    }

    public Batch withStatus(Status next, Instant started, Instant finished) {
        return new Batch(id, userId, name, taskIds, totalTasks, completedTasks, failedTasks, next, parameters,
                createdAt, started, finished);
    }

    public Batch withCounters(int completed, int failed) {
        return new Batch(id, userId, name, taskIds, totalTasks, completed, failed, status, parameters,
                createdAt, startedAt, finishedAt);
    }
}

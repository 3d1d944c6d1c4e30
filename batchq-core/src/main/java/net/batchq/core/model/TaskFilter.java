package net.batchq.core.model;

import java.util.EnumSet;
import java.util.Set;

/** 아카이브 조회 조건. null 필드는 조건에서 제외 */
public record TaskFilter(
        String userId,
        String batchId,
        String symbol,
        Set<Task.Status> statuses,
        int limit
) {
    public static final int DEFAULT_LIMIT = 100;

    public TaskFilter {
        statuses = statuses == null || statuses.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(statuses));
        limit = limit <= 0 ? DEFAULT_LIMIT : limit;
    }

    public static TaskFilter byUser(String userId) {
        return new TaskFilter(userId, null, null, null, DEFAULT_LIMIT);
    }

    public static TaskFilter byBatch(String batchId) {
        return new TaskFilter(null, batchId, null, null, DEFAULT_LIMIT);
    }

    public TaskFilter withStatuses(Set<Task.Status> s) {
        return new TaskFilter(userId, batchId, symbol, s, limit);
    }

    public TaskFilter withLimit(int l) {
        return new TaskFilter(userId, batchId, symbol, statuses, l);
    }
}

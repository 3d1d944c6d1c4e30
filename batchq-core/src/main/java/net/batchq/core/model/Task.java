package net.batchq.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Task(
        String id,
        String userId,
        String symbol,
        Map<String, Object> parameters,   // 분석 엔진으로 그대로 전달 (스케줄러는 해석하지 않음)
        TaskPriority priority,
        Status status,
        String batchId,                   // 소속 배치 (없으면 null)
        String workerId,                  // PROCESSING 동안만 설정
        Instant createdAt,
        Instant enqueuedAt,
        Instant startedAt,
        Instant completedAt,
        Instant cancelledAt,
        Instant requeuedAt,
        int retryCount,                   // lease 만료로 재큐잉된 횟수
        TaskResult result,
        String error
) {
    public enum Status {
        QUEUED, PROCESSING, COMPLETED, FAILED, CANCELLED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }

        public boolean terminal() {
            return this == COMPLETED || this == FAILED || this == CANCELLED;
        }
    }

    public Task {
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        priority = priority == null ? TaskPriority.NORMAL : priority;
    }

    public static Task queued(String id, String userId, String symbol, Map<String, Object> parameters,
                              TaskPriority priority, String batchId, Instant now) {
        return new Task(id, userId, symbol, parameters, priority, Status.QUEUED, batchId, null,
                now, now, null, null, null, null, 0, null, null);
    }

    public boolean terminal() {
        return status.terminal();
    }

    // --- 상태 전이 (새 스냅샷 반환) ---

    public Task started(String worker, Instant now) {
        return new Task(id, userId, symbol, parameters, priority, Status.PROCESSING, batchId, worker,
                createdAt, enqueuedAt, now, null, null, requeuedAt, retryCount, null, null);
    }

    public Task completed(TaskResult r, Instant now) {
        return new Task(id, userId, symbol, parameters, priority, Status.COMPLETED, batchId, null,
                createdAt, enqueuedAt, startedAt, now, null, requeuedAt, retryCount, r, null);
    }

    public Task failed(String err, Instant now) {
        return new Task(id, userId, symbol, parameters, priority, Status.FAILED, batchId, null,
                createdAt, enqueuedAt, startedAt, now, null, requeuedAt, retryCount, null, err);
    }

    public Task cancelled(Instant now) {
        return new Task(id, userId, symbol, parameters, priority, Status.CANCELLED, batchId, null,
                createdAt, enqueuedAt, startedAt, null, now, requeuedAt, retryCount, null, null);
    }

    /** lease 만료 → QUEUED 복귀, retryCount + 1 */
    public Task requeued(Instant now) {
        return new Task(id, userId, symbol, parameters, priority, Status.QUEUED, batchId, null,
                createdAt, enqueuedAt, null, null, null, now, retryCount + 1, null, null);
    }

    /** 종료 시각 (COMPLETED/FAILED는 completedAt, CANCELLED는 cancelledAt) */
    public Instant finishedAt() {
        return status == Status.CANCELLED ? cancelledAt : completedAt;
    }
}

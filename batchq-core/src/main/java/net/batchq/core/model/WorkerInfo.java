package net.batchq.core.model;

import java.time.Instant;

/** 관측용 워커 정보 (휘발성, 영속화하지 않음) */
public record WorkerInfo(
        String id,
        String type,            // 워커/엔진 종류 (예: analysis, batch)
        Status status,
        String currentTaskId,
        Instant lastHeartbeat,
        long tasksProcessed,
        Instant startedAt
) {
    public enum Status {
        IDLE, BUSY;

        public String code() { return name().toLowerCase(); }
    }

    public static WorkerInfo started(String id, String type, Instant now) {
        return new WorkerInfo(id, type, Status.IDLE, null, now, 0, now);
    }

    public WorkerInfo heartbeat(String taskId, Instant now) {
        return new WorkerInfo(id, type, taskId == null ? Status.IDLE : Status.BUSY, taskId, now, tasksProcessed, startedAt);
    }

    public WorkerInfo assigned(String taskId) {
        return new WorkerInfo(id, type, Status.BUSY, taskId, lastHeartbeat, tasksProcessed, startedAt);
    }

    /** 담당 태스크 해제. processed=true면 처리 건수 증가 */
    public WorkerInfo released(boolean processed) {
        return new WorkerInfo(id, type, Status.IDLE, null, lastHeartbeat,
                processed ? tasksProcessed + 1 : tasksProcessed, startedAt);
    }
}

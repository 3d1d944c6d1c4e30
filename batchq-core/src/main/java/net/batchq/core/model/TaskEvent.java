package net.batchq.core.model;

import java.time.Instant;

public record TaskEvent(
        Type type,
        Task task,
        Instant at
) {
    public enum Type {
        ENQUEUED, STARTED, COMPLETED, FAILED, CANCELLED, REQUEUED
    }
}

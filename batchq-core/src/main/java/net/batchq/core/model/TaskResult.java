package net.batchq.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record TaskResult(
        Map<String, Object> data,
        String message,
        Long durationMs
) {
    public TaskResult {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static TaskResult of(Map<String, Object> data) {
        return new TaskResult(data, null, null);
    }
}

package net.batchq.core.model;

import java.util.List;
import java.util.Map;

public record CreateBatchRequest(
        String userId,
        List<String> symbols,
        Map<String, Object> parameters,   // 모든 멤버 태스크에 공통 적용
        TaskPriority priority,
        String name                       // null 이면 "Batch <n> symbols"
) {
    public static CreateBatchRequest of(String userId, List<String> symbols) {
        return new CreateBatchRequest(userId, symbols, Map.of(), TaskPriority.NORMAL, null);
    }

    public CreateBatchRequest withPriority(TaskPriority p) {
        return new CreateBatchRequest(userId, symbols, parameters, p, name);
    }

    public CreateBatchRequest withName(String n) {
        return new CreateBatchRequest(userId, symbols, parameters, priority, n);
    }
}

package net.batchq.core.model;

import java.util.Map;

/** 단건 등록 요청. batchId 는 태그일 뿐이며 배치 멤버십은 createBatch 에서만 생긴다. */
public record EnqueueRequest(
        String userId,
        String symbol,
        Map<String, Object> parameters,
        TaskPriority priority,
        String batchId
) {
    public static EnqueueRequest of(String userId, String symbol) {
        return new EnqueueRequest(userId, symbol, Map.of(), TaskPriority.NORMAL, null);
    }

    public EnqueueRequest withPriority(TaskPriority p) {
        return new EnqueueRequest(userId, symbol, parameters, p, batchId);
    }

    public EnqueueRequest withParameters(Map<String, Object> params) {
        return new EnqueueRequest(userId, symbol, params, priority, batchId);
    }
}

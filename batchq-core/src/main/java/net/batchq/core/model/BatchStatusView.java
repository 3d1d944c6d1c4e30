package net.batchq.core.model;

import java.util.Map;

/** 배치 스냅샷 + 멤버 태스크별 상태 (taskIds 순서) */
public record BatchStatusView(
        Batch batch,
        Map<String, Task.Status> taskStatuses
) {}

package net.batchq.core.service;

import net.batchq.core.model.Task;
import net.batchq.core.model.TaskFilter;
import net.batchq.core.spi.TaskArchive;
import net.batchq.core.spi.TxRunner;

import java.util.List;
import java.util.Optional;

/** 아카이브 조회 (메모리에서 정리된 태스크 포함) */
public final class TaskHistoryService {
    private final TaskArchive archive;
    private final TxRunner tx;

    public TaskHistoryService(TaskArchive archive, TxRunner tx) {
        this.archive = archive;
        this.tx = tx;
    }

    public Optional<Task> find(String taskId) throws Exception {
        return tx.required(() -> archive.load(taskId));
    }

    public List<Task> query(TaskFilter filter) throws Exception {
        return tx.required(() -> archive.query(filter));
    }

    public List<Task> recentForUser(String userId, int limit) throws Exception {
        return query(TaskFilter.byUser(userId).withLimit(limit));
    }

    public List<Task> batchMembers(String batchId) throws Exception {
        return query(TaskFilter.byBatch(batchId).withLimit(Integer.MAX_VALUE));
    }
}

package net.batchq.core.spi;

import net.batchq.core.model.Task;
import net.batchq.core.model.TaskFilter;

import java.util.List;
import java.util.Optional;

/**
 * 태스크 이력 저장소 (선택).
 * 활성 스케줄링의 기준은 항상 메모리 상태이며, 여기는 이력/감사 용도.
 * 구현체는 TxRunner 경계 안에서 호출된다.
 */
public interface TaskArchive {
    /** 멱등 upsert: ID 기준 */
    void save(Task task) throws Exception;

    Optional<Task> load(String taskId) throws Exception;

    /** createdAt 내림차순, filter.limit 건까지 */
    List<Task> query(TaskFilter filter) throws Exception;
}

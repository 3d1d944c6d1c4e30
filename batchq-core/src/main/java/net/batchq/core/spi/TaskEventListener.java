package net.batchq.core.spi;

import net.batchq.core.model.Batch;
import net.batchq.core.model.TaskEvent;

/** 상태 전이 알림. 스케줄러 락 밖에서, 전이 순서대로 호출된다. */
public interface TaskEventListener {
    default void onTaskEvent(TaskEvent event) {}

    /** 배치가 종료 상태(COMPLETED/FAILED/CANCELLED)에 도달했을 때 한 번 */
    default void onBatchFinished(Batch batch) {}
}

package net.batchq.core.spi;

import net.batchq.core.model.Task;
import net.batchq.core.model.TaskResult;

/** dequeue 된 태스크를 실제로 계산하는 쪽. 실패는 예외로 알린다. */
@FunctionalInterface
public interface AnalysisEngine {
    TaskResult analyze(Task task) throws Exception;
}

package net.batchq.core.queue;

import net.batchq.core.model.Task;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * id → Task 스냅샷. 상태별 건수는 put/remove 시점에 같이 갱신한다.
 * 스레드 안전하지 않음: TaskScheduler 락 안에서만 호출된다.
 */
public final class TaskStore {
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final EnumMap<Task.Status, Integer> counts = new EnumMap<>(Task.Status.class);

    public Optional<Task> get(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    /** 새 스냅샷으로 교체. 이전 스냅샷 반환 */
    public Optional<Task> put(Task task) {
        Task prev = tasks.put(task.id(), task);
        if (prev != null) decrement(prev.status());
        counts.merge(task.status(), 1, Integer::sum);
        return Optional.ofNullable(prev);
    }

    public Optional<Task> remove(String taskId) {
        Task prev = tasks.remove(taskId);
        if (prev != null) decrement(prev.status());
        return Optional.ofNullable(prev);
    }

    public int count(Task.Status status) {
        return counts.getOrDefault(status, 0);
    }

    public int size() {
        return tasks.size();
    }

    public Collection<Task> all() {
        return Collections.unmodifiableCollection(tasks.values());
    }

    /** finishedAt 이 threshold 이전인 종료 태스크를 제거하고 반환 */
    public List<Task> purgeFinishedBefore(Instant threshold) {
        List<Task> purged = new ArrayList<>();
        for (Iterator<Task> it = tasks.values().iterator(); it.hasNext(); ) {
            Task t = it.next();
            Instant finished = t.finishedAt();
            if (t.terminal() && finished != null && finished.isBefore(threshold)) {
                it.remove();
                decrement(t.status());
                purged.add(t);
            }
        }
        return purged;
    }

    private void decrement(Task.Status status) {
        counts.computeIfPresent(status, (s, n) -> n <= 1 ? null : n - 1);
    }
}

package net.batchq.core.queue;

import net.batchq.core.model.TaskPriority;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 우선순위 밴드별 FIFO 목록.
 * - 밴드 간에는 엄격한 우선순위 (URGENT 전부 → HIGH → ...)
 * - 밴드 안에서는 삽입 순서
 * 스레드 안전하지 않음: TaskScheduler 락 안에서만 호출된다.
 */
public final class PriorityTaskQueue {
    private final List<ArrayDeque<String>> bands = new ArrayList<>();
    private final Map<String, TaskPriority> index = new HashMap<>();

    public PriorityTaskQueue() {
        for (int i = 0; i < TaskPriority.values().length; i++) {
            bands.add(new ArrayDeque<>());
        }
    }

    /** 밴드 끝에 추가. 이미 들어있는 id면 false */
    public boolean push(String taskId, TaskPriority priority) {
        if (index.putIfAbsent(taskId, priority) != null) return false;
        band(priority).addLast(taskId);
        return true;
    }

    /** 밴드 맨 앞에 되돌려 놓는다 (pop 했다가 입장 거절된 항목) */
    public boolean pushFront(String taskId, TaskPriority priority) {
        if (index.putIfAbsent(taskId, priority) != null) return false;
        band(priority).addFirst(taskId);
        return true;
    }

    public Optional<String> pop() {
        for (int i = bands.size() - 1; i >= 0; i--) {
            String id = bands.get(i).pollFirst();
            if (id != null) {
                index.remove(id);
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    public boolean remove(String taskId) {
        TaskPriority p = index.remove(taskId);
        if (p == null) return false;
        return band(p).remove(taskId);
    }

    public boolean contains(String taskId) {
        return index.containsKey(taskId);
    }

    public int size() {
        return index.size();
    }

    public int size(TaskPriority priority) {
        return band(priority).size();
    }

    private ArrayDeque<String> band(TaskPriority priority) {
        return bands.get(priority.ordinal());
    }
}

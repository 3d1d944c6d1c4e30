package net.batchq.core.queue;

import net.batchq.core.model.WorkerInfo;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 워커 관측 정보. 스케줄링 판단에는 쓰이지 않는다.
 * heartbeat 은 스케줄러 락 없이 들어오므로 자체적으로 스레드 안전하다.
 */
public final class WorkerRegistry {
    private final Map<String, WorkerInfo> workers = new ConcurrentHashMap<>();

    /** 같은 id로 다시 등록하면 새 정보로 교체 */
    public WorkerInfo register(String workerId, String type, Instant now) {
        WorkerInfo info = WorkerInfo.started(workerId, type, now);
        workers.put(workerId, info);
        return info;
    }

    public boolean heartbeat(String workerId, String currentTaskId, Instant now) {
        return workers.computeIfPresent(workerId, (id, w) -> w.heartbeat(currentTaskId, now)) != null;
    }

    public boolean unregister(String workerId) {
        return workers.remove(workerId) != null;
    }

    public Optional<WorkerInfo> get(String workerId) {
        return Optional.ofNullable(workers.get(workerId));
    }

    /** 미등록 워커면 무시 */
    public void assign(String workerId, String taskId) {
        if (workerId == null) return;
        workers.computeIfPresent(workerId, (id, w) -> w.assigned(taskId));
    }

    /** 워커가 아직 그 태스크를 들고 있을 때만 해제 */
    public void release(String workerId, String taskId, boolean processed) {
        if (workerId == null) return;
        workers.computeIfPresent(workerId, (id, w) -> {
            if (w.currentTaskId() != null && !w.currentTaskId().equals(taskId)) {
                return processed ? w.released(true).assigned(w.currentTaskId()) : w;
            }
            return w.released(processed);
        });
    }

    public List<WorkerInfo> list() {
        List<WorkerInfo> out = new ArrayList<>(workers.values());
        out.sort(Comparator.comparing(WorkerInfo::id));
        return out;
    }

    /** lastHeartbeat 이 threshold 이전인 워커 제거 */
    public List<WorkerInfo> removeStale(Instant threshold) {
        List<WorkerInfo> removed = new ArrayList<>();
        for (WorkerInfo w : workers.values()) {
            if (w.lastHeartbeat().isBefore(threshold) && workers.remove(w.id(), w)) {
                removed.add(w);
            }
        }
        removed.sort(Comparator.comparing(WorkerInfo::id));
        return removed;
    }

    public int size() {
        return workers.size();
    }
}

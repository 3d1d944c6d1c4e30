package net.batchq.core.queue;

import net.batchq.core.model.Batch;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * id → Batch 스냅샷과 멤버십.
 * 카운터는 종료 상태가 아닌 배치에만 반영되고, completed + failed == total 이 되면 종료로 전이한다.
 * 스레드 안전하지 않음: TaskScheduler 락 안에서만 호출된다.
 */
public final class BatchStore {
    private final Map<String, Batch> batches = new LinkedHashMap<>();
    private final Map<String, Set<String>> members = new LinkedHashMap<>();

    public void add(Batch batch) {
        if (batches.putIfAbsent(batch.id(), batch) != null) {
            throw new IllegalStateException("batch already exists: " + batch.id());
        }
        members.put(batch.id(), new HashSet<>(batch.taskIds()));
    }

    public Optional<Batch> get(String batchId) {
        return Optional.ofNullable(batches.get(batchId));
    }

    public boolean isMember(String batchId, String taskId) {
        Set<String> m = members.get(batchId);
        return m != null && m.contains(taskId);
    }

    /** 첫 멤버 dequeue: PENDING → PROCESSING */
    public Optional<Batch> markStarted(String batchId, Instant now) {
        Batch b = batches.get(batchId);
        if (b == null || b.status() != Batch.Status.PENDING) return Optional.empty();
        Batch next = b.withStatus(Batch.Status.PROCESSING, now, null);
        batches.put(batchId, next);
        return Optional.of(next);
    }

    /**
     * 멤버 한 건의 완료/실패 반영.
     * 모든 멤버가 집계되면 실패가 하나라도 있으면 FAILED, 아니면 COMPLETED.
     */
    public Optional<Batch> recordOutcome(String batchId, boolean success, Instant now) {
        Batch b = batches.get(batchId);
        if (b == null || b.terminal()) return Optional.empty();
        Batch next = success
                ? b.withCounters(b.completedTasks() + 1, b.failedTasks())
                : b.withCounters(b.completedTasks(), b.failedTasks() + 1);
        if (next.completedTasks() + next.failedTasks() == next.totalTasks()) {
            Batch.Status done = next.failedTasks() > 0 ? Batch.Status.FAILED : Batch.Status.COMPLETED;
            next = next.withStatus(done, next.startedAt(), now);
        }
        batches.put(batchId, next);
        return Optional.of(next);
    }

    /** 종료 상태가 아니면 CANCELLED 로 */
    public Optional<Batch> cancel(String batchId, Instant now) {
        Batch b = batches.get(batchId);
        if (b == null || b.terminal()) return Optional.empty();
        Batch next = b.withStatus(Batch.Status.CANCELLED, b.startedAt(), now);
        batches.put(batchId, next);
        return Optional.of(next);
    }

    public Map<Batch.Status, Integer> countByStatus() {
        EnumMap<Batch.Status, Integer> out = new EnumMap<>(Batch.Status.class);
        for (Batch b : batches.values()) {
            out.merge(b.status(), 1, Integer::sum);
        }
        return out;
    }

    public int size() {
        return batches.size();
    }

    public Collection<Batch> all() {
        return Collections.unmodifiableCollection(batches.values());
    }

    /** 조건에 맞는 배치를 제거하고 반환 */
    public List<Batch> removeIf(Predicate<Batch> condition) {
        List<Batch> removed = new ArrayList<>();
        for (Iterator<Batch> it = batches.values().iterator(); it.hasNext(); ) {
            Batch b = it.next();
            if (condition.test(b)) {
                it.remove();
                members.remove(b.id());
                removed.add(b);
            }
        }
        return removed;
    }
}

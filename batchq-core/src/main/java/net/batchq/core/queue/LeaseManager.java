package net.batchq.core.queue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 워커가 쥐고 있는 태스크의 만료 시각(visibility timeout) 테이블.
 * 스레드 안전하지 않음: TaskScheduler 락 안에서만 호출된다.
 */
public final class LeaseManager {

    public record Lease(String taskId, String workerId, Instant deadline) {}

    private final Map<String, Lease> leases = new HashMap<>();

    public void acquire(String taskId, String workerId, Instant deadline) {
        leases.put(taskId, new Lease(taskId, workerId, deadline));
    }

    /** 같은 워커가 쥔 lease만 연장 */
    public boolean extend(String taskId, String workerId, Instant deadline) {
        Lease l = leases.get(taskId);
        if (l == null || !l.workerId().equals(workerId)) return false;
        leases.put(taskId, new Lease(taskId, workerId, deadline));
        return true;
    }

    public boolean release(String taskId) {
        return leases.remove(taskId) != null;
    }

    public Optional<Lease> get(String taskId) {
        return Optional.ofNullable(leases.get(taskId));
    }

    /** deadline 이 now 보다 과거인 lease를 제거하고 반환 (deadline 오름차순) */
    public List<Lease> sweep(Instant now) {
        List<Lease> expired = new ArrayList<>();
        for (Iterator<Lease> it = leases.values().iterator(); it.hasNext(); ) {
            Lease l = it.next();
            if (now.isAfter(l.deadline())) {
                expired.add(l);
                it.remove();
            }
        }
        expired.sort(Comparator.comparing(Lease::deadline));
        return expired;
    }

    public int size() {
        return leases.size();
    }
}

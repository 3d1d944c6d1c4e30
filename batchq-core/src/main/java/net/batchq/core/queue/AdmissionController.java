package net.batchq.core.queue;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 사용자별/전역 동시 처리(in-flight) 상한.
 * 슬롯은 태스크 단위로 잡고 풀기 때문에 같은 태스크에 대한 중복 release는 무시된다.
 * 스레드 안전하지 않음: TaskScheduler 락 안에서만 호출된다.
 */
public final class AdmissionController {
    private final int userLimit;
    private final int globalLimit;

    private final Map<String, String> holders = new HashMap<>();   // taskId -> userId
    private final Map<String, Integer> perUser = new HashMap<>();  // userId -> in-flight

    public AdmissionController(int userLimit, int globalLimit) {
        if (userLimit <= 0 || globalLimit <= 0) {
            throw new IllegalArgumentException("limits must be positive: user=" + userLimit + ", global=" + globalLimit);
        }
        this.userLimit = userLimit;
        this.globalLimit = globalLimit;
    }

    /** 입장 불가 사유. 비어 있으면 입장 가능 (카운터는 건드리지 않음) */
    public Optional<String> check(String userId) {
        if (holders.size() >= globalLimit) {
            return Optional.of("global concurrent limit reached (" + globalLimit + ")");
        }
        if (inFlight(userId) >= userLimit) {
            return Optional.of("user " + userId + " reached concurrent limit (" + userLimit + ")");
        }
        return Optional.empty();
    }

    public boolean canAdmit(String userId) {
        return check(userId).isEmpty();
    }

    /** 검사 + 슬롯 점유를 한 번에 */
    public boolean tryAdmit(String userId, String taskId) {
        if (holders.containsKey(taskId)) {
            throw new IllegalStateException("task " + taskId + " already holds a slot");
        }
        if (!canAdmit(userId)) return false;
        holders.put(taskId, userId);
        perUser.merge(userId, 1, Integer::sum);
        return true;
    }

    /** 점유 중이던 슬롯을 반납. 이미 반납된 태스크면 false */
    public boolean release(String taskId) {
        String userId = holders.remove(taskId);
        if (userId == null) return false;
        perUser.computeIfPresent(userId, (u, n) -> n <= 1 ? null : n - 1);
        return true;
    }

    public boolean holds(String taskId) {
        return holders.containsKey(taskId);
    }

    public int inFlight(String userId) {
        return perUser.getOrDefault(userId, 0);
    }

    public int globalInFlight() {
        return holders.size();
    }

    public int userLimit() {
        return userLimit;
    }

    public int globalLimit() {
        return globalLimit;
    }
}

package net.batchq.core.service;

import net.batchq.core.model.Batch;
import net.batchq.core.model.BatchCreated;
import net.batchq.core.model.BatchQueueStats;
import net.batchq.core.model.BatchStatusView;
import net.batchq.core.model.CreateBatchRequest;
import net.batchq.core.model.EnqueueRequest;
import net.batchq.core.model.QueueStats;
import net.batchq.core.model.Task;
import net.batchq.core.model.TaskEvent;
import net.batchq.core.model.TaskPriority;
import net.batchq.core.model.TaskResult;
import net.batchq.core.model.UserQueueStatus;
import net.batchq.core.model.WorkerInfo;
import net.batchq.core.queue.AdmissionController;
import net.batchq.core.queue.BatchStore;
import net.batchq.core.queue.LeaseManager;
import net.batchq.core.queue.PriorityTaskQueue;
import net.batchq.core.queue.TaskStore;
import net.batchq.core.queue.WorkerRegistry;
import net.batchq.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 큐/배치/입장/lease 를 하나의 락으로 묶은 스케줄러 진입점.
 * - 모든 공개 연산은 하나의 임계 구역
 * - dequeue 는 블로킹하지 않는다 (없으면 empty)
 * - 이벤트(아카이브 미러 포함)는 락 안에서 확정 순서대로 쌓고, 락을 푼 뒤 전달한다
 */
public final class TaskScheduler {
    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    /** 배치 예상 소요시간 계산용 (태스크당) */
    public static final long ESTIMATED_SECONDS_PER_TASK = 30;

    private final SchedulerConfig config;
    private final Clock clock;
    private final TaskEventPublisher publisher;

    private final ReentrantLock lock = new ReentrantLock();
    private final TaskStore tasks = new TaskStore();
    private final BatchStore batches = new BatchStore();
    private final PriorityTaskQueue queue = new PriorityTaskQueue();
    private final LeaseManager leases = new LeaseManager();
    private final AdmissionController admission;
    private final WorkerRegistry workers = new WorkerRegistry();

    public TaskScheduler(SchedulerConfig config, Clock clock, TaskEventPublisher publisher) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.admission = new AdmissionController(config.userConcurrentLimit(), config.globalConcurrentLimit());
    }

    public TaskScheduler(SchedulerConfig config, Clock clock) {
        this(config, clock, TaskEventPublisher.none());
    }

    public SchedulerConfig config() {
        return config;
    }

    // ------------------------------------------------------------------ tasks

    public Outcome<String> enqueue(String userId, String symbol, Map<String, Object> parameters, TaskPriority priority) {
        return enqueue(new EnqueueRequest(userId, symbol, parameters, priority, null));
    }

    /** 입장 가능(사용자/전역 상한 미만)하고 큐에 자리가 있으면 QUEUED 로 등록 */
    public Outcome<String> enqueue(EnqueueRequest request) {
        Objects.requireNonNull(request, "request");
        if (isBlank(request.userId())) return Outcome.failure(ErrorCode.INVALID_INPUT, "userId is required");
        if (isBlank(request.symbol())) return Outcome.failure(ErrorCode.INVALID_INPUT, "symbol is required");

        Changes changes = new Changes();
        lock.lock();
        try {
            Optional<String> denied = denyReason(request.userId(), 1);
            if (denied.isPresent()) {
                log.debug("enqueue denied: user={} symbol={} reason={}", request.userId(), request.symbol(), denied.get());
                return Outcome.failure(ErrorCode.ADMISSION_DENIED, denied.get());
            }
            Instant now = clock.now();
            Task t = Task.queued(newId(), request.userId(), request.symbol(), request.parameters(),
                    request.priority(), request.batchId(), now);
            tasks.put(t);
            queue.push(t.id(), t.priority());
            changes.task(TaskEvent.Type.ENQUEUED, t, now);
            log.debug("enqueued task {} user={} symbol={} priority={}", t.id(), t.userId(), t.symbol(), t.priority());
            return Outcome.success(t.id());
        } finally {
            unlockAndPublish(changes);
        }
    }

    /**
     * 가장 높은 우선순위 밴드의 맨 앞 태스크를 꺼내 PROCESSING 으로 전환.
     * 맨 앞 태스크가 입장 재검사에 걸리면 제자리에 되돌리고 empty (head-of-line).
     */
    public Optional<Task> dequeue(String workerId) {
        Objects.requireNonNull(workerId, "workerId");
        Changes changes = new Changes();
        lock.lock();
        try {
            while (true) {
                Optional<String> next = queue.pop();
                if (next.isEmpty()) return Optional.empty();

                String id = next.get();
                Task t = tasks.get(id).orElse(null);
                if (t == null || t.status() != Task.Status.QUEUED) {
                    log.warn("dropping stale queue entry {} ({})", id, t == null ? "missing" : t.status());
                    continue;
                }
                if (!admission.tryAdmit(t.userId(), id)) {
                    queue.pushFront(id, t.priority());
                    log.debug("dequeue blocked: head task {} user={} over limit", id, t.userId());
                    return Optional.empty();
                }

                Instant now = clock.now();
                Task started = t.started(workerId, now);
                tasks.put(started);
                leases.acquire(id, workerId, now.plus(config.visibilityTimeout()));
                workers.assign(workerId, id);
                if (started.batchId() != null && batches.isMember(started.batchId(), id)) {
                    batches.markStarted(started.batchId(), now);
                }
                changes.task(TaskEvent.Type.STARTED, started, now);
                log.debug("task {} -> PROCESSING worker={}", id, workerId);
                return Optional.of(started);
            }
        } finally {
            unlockAndPublish(changes);
        }
    }

    /**
     * 처리 결과 보고. PROCESSING 인 태스크에만 적용되며 그 외(미존재/QUEUED/종료)는 false.
     * 성공이면 result, 실패면 error 만 기록한다.
     */
    public boolean ack(String taskId, boolean success, TaskResult result, String error) {
        return ack(taskId, null, success, result, error);
    }

    /** workerId 가 주어지면 현재 lease 보유 워커일 때만 적용 (재큐잉 이전 워커의 늦은 ack 차단) */
    public boolean ack(String taskId, String workerId, boolean success, TaskResult result, String error) {
        Objects.requireNonNull(taskId, "taskId");
        Changes changes = new Changes();
        lock.lock();
        try {
            Task t = tasks.get(taskId).orElse(null);
            if (t == null) {
                log.debug("ack ignored: unknown task {}", taskId);
                return false;
            }
            if (t.status() != Task.Status.PROCESSING) {
                log.debug("ack ignored: task {} is {}", taskId, t.status());
                return false;
            }
            if (workerId != null && !workerId.equals(t.workerId())) {
                log.debug("ack ignored: task {} held by {} not {}", taskId, t.workerId(), workerId);
                return false;
            }
            Instant now = clock.now();
            Task done = success
                    ? t.completed(result, now)
                    : t.failed(error == null || error.isBlank() ? "unknown error" : error, now);
            tasks.put(done);
            releaseHold(t, true);
            changes.task(success ? TaskEvent.Type.COMPLETED : TaskEvent.Type.FAILED, done, now);
            settleBatch(done, now, changes);
            log.debug("task {} -> {}", taskId, done.status());
            return true;
        } finally {
            unlockAndPublish(changes);
        }
    }

    public boolean ackSuccess(String taskId, TaskResult result) {
        return ack(taskId, true, result, null);
    }

    public boolean ackFailure(String taskId, String error) {
        return ack(taskId, false, null, error);
    }

    /** 보유 워커의 lease 를 visibilityTimeout 만큼 다시 연장 */
    public boolean extendLease(String taskId, String workerId) {
        lock.lock();
        try {
            Task t = tasks.get(taskId).orElse(null);
            if (t == null || t.status() != Task.Status.PROCESSING || !Objects.equals(t.workerId(), workerId)) {
                return false;
            }
            return leases.extend(taskId, workerId, clock.now().plus(config.visibilityTimeout()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * QUEUED: 큐에서 제거. PROCESSING: lease/입장 슬롯 즉시 반납 (이후 ack 는 no-op).
     * 미존재 태스크는 NOT_FOUND, 이미 종료된 태스크는 success(false).
     */
    public Outcome<Boolean> cancel(String taskId) {
        Objects.requireNonNull(taskId, "taskId");
        Changes changes = new Changes();
        lock.lock();
        try {
            Task t = tasks.get(taskId).orElse(null);
            if (t == null) return Outcome.failure(ErrorCode.NOT_FOUND, "task not found: " + taskId);
            if (t.terminal()) {
                log.debug("cancel ignored: task {} is already {}", taskId, t.status());
                return Outcome.success(false);
            }
            cancelLocked(t, clock.now(), changes);
            return Outcome.success(true);
        } finally {
            unlockAndPublish(changes);
        }
    }

    public Optional<Task> getTask(String taskId) {
        lock.lock();
        try {
            return tasks.get(taskId);
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- batches

    public Outcome<BatchCreated> createBatch(String userId, List<String> symbols, Map<String, Object> parameters,
                                             TaskPriority priority) {
        return createBatch(new CreateBatchRequest(userId, symbols, parameters, priority, null));
    }

    /**
     * 심볼마다 태스크 하나를 만들어 하나의 배치로 묶는다.
     * 하나라도 등록에 실패하면 이미 만든 태스크를 되돌리고 배치도 만들지 않는다.
     */
    public Outcome<BatchCreated> createBatch(CreateBatchRequest request) {
        Objects.requireNonNull(request, "request");
        if (isBlank(request.userId())) return Outcome.failure(ErrorCode.INVALID_INPUT, "userId is required");
        List<String> symbols = request.symbols();
        if (symbols == null || symbols.isEmpty()) {
            return Outcome.failure(ErrorCode.INVALID_INPUT, "no symbols provided");
        }
        if (symbols.size() > config.maxBatchSize()) {
            return Outcome.failure(ErrorCode.BATCH_TOO_LARGE,
                    "batch of " + symbols.size() + " exceeds maximum of " + config.maxBatchSize());
        }
        for (String s : symbols) {
            if (isBlank(s)) return Outcome.failure(ErrorCode.INVALID_INPUT, "blank symbol in batch");
        }

        Changes changes = new Changes();
        lock.lock();
        try {
            Optional<String> denied = admission.check(request.userId());
            if (denied.isPresent()) {
                log.debug("batch denied: user={} size={} reason={}", request.userId(), symbols.size(), denied.get());
                return Outcome.failure(ErrorCode.ADMISSION_DENIED, denied.get());
            }

            Instant now = clock.now();
            String batchId = newId();
            List<Task> created = new ArrayList<>(symbols.size());
            for (String symbol : symbols) {
                if (queue.size() >= config.maxQueueSize()) {
                    rollback(created);
                    log.debug("batch denied: queue full after {} of {} tasks, rolled back", created.size(), symbols.size());
                    return Outcome.failure(ErrorCode.ADMISSION_DENIED,
                            "queue is full (" + config.maxQueueSize() + ")");
                }
                Task t = Task.queued(newId(), request.userId(), symbol, request.parameters(),
                        request.priority(), batchId, now);
                tasks.put(t);
                queue.push(t.id(), t.priority());
                created.add(t);
            }

            List<String> ids = created.stream().map(Task::id).toList();
            String name = isBlank(request.name()) ? "Batch " + ids.size() + " symbols" : request.name();
            batches.add(Batch.pending(batchId, request.userId(), name, ids, request.parameters(), now));
            for (Task t : created) {
                changes.task(TaskEvent.Type.ENQUEUED, t, now);
            }
            log.info("created batch {} '{}' user={} tasks={}", batchId, name, request.userId(), ids.size());
            return Outcome.success(new BatchCreated(batchId, ids, ids.size() * ESTIMATED_SECONDS_PER_TASK));
        } finally {
            unlockAndPublish(changes);
        }
    }

    public Outcome<BatchStatusView> getBatchStatus(String batchId) {
        lock.lock();
        try {
            Batch b = batches.get(batchId).orElse(null);
            if (b == null) return Outcome.failure(ErrorCode.NOT_FOUND, "batch not found: " + batchId);
            Map<String, Task.Status> statuses = new LinkedHashMap<>();
            for (String id : b.taskIds()) {
                tasks.get(id).ifPresent(t -> statuses.put(id, t.status()));
            }
            return Outcome.success(new BatchStatusView(b, statuses));
        } finally {
            lock.unlock();
        }
    }

    public Optional<Batch> getBatch(String batchId) {
        lock.lock();
        try {
            return batches.get(batchId);
        } finally {
            lock.unlock();
        }
    }

    /** 종료되지 않은 멤버를 모두 취소. 취소한 태스크 수를 돌려준다 (이미 종료된 배치면 0) */
    public Outcome<Integer> cancelBatch(String batchId) {
        Changes changes = new Changes();
        lock.lock();
        try {
            Batch b = batches.get(batchId).orElse(null);
            if (b == null) return Outcome.failure(ErrorCode.NOT_FOUND, "batch not found: " + batchId);
            if (b.terminal()) return Outcome.success(0);

            Instant now = clock.now();
            int cancelled = 0;
            for (String id : b.taskIds()) {
                Task t = tasks.get(id).orElse(null);
                if (t == null || t.terminal()) continue;
                cancelLocked(t, now, changes);
                cancelled++;
            }
            // 멤버가 모두 종료되면 settleBatch 에서 이미 닫힌다
            batches.cancel(batchId, now).ifPresent(changes::batchFinished);
            log.info("cancelled batch {} ({} tasks)", batchId, cancelled);
            return Outcome.success(cancelled);
        } finally {
            unlockAndPublish(changes);
        }
    }

    // ------------------------------------------------------------------ stats

    public QueueStats getQueueStats() {
        lock.lock();
        try {
            return queueStatsLocked();
        } finally {
            lock.unlock();
        }
    }

    public BatchQueueStats getBatchQueueStats() {
        lock.lock();
        try {
            Map<Batch.Status, Integer> byStatus = batches.countByStatus();
            return new BatchQueueStats(
                    queueStatsLocked(),
                    byStatus.getOrDefault(Batch.Status.PROCESSING, 0),
                    byStatus.getOrDefault(Batch.Status.COMPLETED, 0) + byStatus.getOrDefault(Batch.Status.FAILED, 0),
                    byStatus.getOrDefault(Batch.Status.PENDING, 0));
        } finally {
            lock.unlock();
        }
    }

    public UserQueueStatus getUserQueueStatus(String userId) {
        lock.lock();
        try {
            int processing = admission.inFlight(userId);
            int limit = admission.userLimit();
            return new UserQueueStatus(userId, processing, limit, Math.max(0, limit - processing));
        } finally {
            lock.unlock();
        }
    }

    private QueueStats queueStatsLocked() {
        return new QueueStats(
                tasks.count(Task.Status.QUEUED),
                tasks.count(Task.Status.PROCESSING),
                tasks.count(Task.Status.COMPLETED),
                tasks.count(Task.Status.FAILED),
                tasks.count(Task.Status.CANCELLED),
                tasks.size());
    }

    // ---------------------------------------------------------------- workers

    public WorkerInfo registerWorker(String workerId, String type) {
        Objects.requireNonNull(workerId, "workerId");
        WorkerInfo w = workers.register(workerId, type, clock.now());
        log.info("registered worker {} type={}", workerId, type);
        return w;
    }

    public boolean heartbeat(String workerId, String currentTaskId) {
        return workers.heartbeat(workerId, currentTaskId, clock.now());
    }

    public boolean unregisterWorker(String workerId) {
        boolean removed = workers.unregister(workerId);
        if (removed) log.info("unregistered worker {}", workerId);
        return removed;
    }

    public List<WorkerInfo> listWorkers() {
        return workers.list();
    }

    /** lastHeartbeat 이 timeout 보다 오래된 워커를 레지스트리에서 제거 */
    public List<WorkerInfo> removeStaleWorkers(Duration timeout) {
        List<WorkerInfo> removed = workers.removeStale(clock.now().minus(timeout));
        for (WorkerInfo w : removed) {
            log.warn("removed stale worker {} (last heartbeat {}, current task {})",
                    w.id(), w.lastHeartbeat(), w.currentTaskId());
        }
        return removed;
    }

    /** currentTaskId 가 자신이 PROCESSING 으로 들고 있는 태스크가 아닌 워커 */
    public List<WorkerInfo> findWorkerLeaks() {
        lock.lock();
        try {
            List<WorkerInfo> leaks = new ArrayList<>();
            for (WorkerInfo w : workers.list()) {
                if (w.currentTaskId() == null) continue;
                Task t = tasks.get(w.currentTaskId()).orElse(null);
                if (t == null || t.status() != Task.Status.PROCESSING || !w.id().equals(t.workerId())) {
                    leaks.add(w);
                }
            }
            return leaks;
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------ maintenance

    public record SweepResult(List<String> requeued, List<String> failed) {
        public SweepResult {
            requeued = List.copyOf(requeued);
            failed = List.copyOf(failed);
        }

        public int total() {
            return requeued.size() + failed.size();
        }
    }

    /**
     * 만료된 lease 회수.
     * 재시도 정책이 허용하면 QUEUED 로 되돌려 원래 우선순위 밴드 끝에 넣고 (retryCount + 1),
     * 아니면 FAILED 로 종료한다.
     */
    public SweepResult recoverExpiredLeases() {
        Changes changes = new Changes();
        List<String> requeued = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        lock.lock();
        try {
            Instant now = clock.now();
            for (LeaseManager.Lease lease : leases.sweep(now)) {
                Task t = tasks.get(lease.taskId()).orElse(null);
                if (t == null || t.status() != Task.Status.PROCESSING) continue;

                admission.release(t.id());
                workers.release(t.workerId(), t.id(), false);
                if (config.retryPolicy().allowsRequeue(t.retryCount())) {
                    Task q = t.requeued(now);
                    tasks.put(q);
                    queue.push(q.id(), q.priority());
                    requeued.add(q.id());
                    changes.task(TaskEvent.Type.REQUEUED, q, now);
                    log.warn("lease expired: task {} worker={} deadline={} -> requeued (retry {})",
                            t.id(), lease.workerId(), lease.deadline(), q.retryCount());
                } else {
                    Task f = t.failed("lease expired after " + t.retryCount() + " requeues", now);
                    tasks.put(f);
                    failed.add(f.id());
                    changes.task(TaskEvent.Type.FAILED, f, now);
                    settleBatch(f, now, changes);
                    log.warn("lease expired: task {} worker={} retries exhausted ({}) -> FAILED",
                            t.id(), lease.workerId(), t.retryCount());
                }
            }
            return new SweepResult(requeued, failed);
        } finally {
            unlockAndPublish(changes);
        }
    }

    public int cleanupOldTasks() {
        return cleanupOldTasks(config.taskCleanupAge());
    }

    /** 종료 시각이 maxAge 보다 오래된 종료 태스크와, 멤버가 모두 정리된 종료 배치를 메모리에서 제거 */
    public int cleanupOldTasks(Duration maxAge) {
        lock.lock();
        try {
            Instant threshold = clock.now().minus(maxAge);
            List<Task> purged = tasks.purgeFinishedBefore(threshold);
            if (!purged.isEmpty()) {
                List<Batch> dropped = batches.removeIf(b -> b.terminal()
                        && b.taskIds().stream().noneMatch(id -> tasks.get(id).isPresent()));
                log.info("cleaned up {} finished tasks and {} batches older than {}", purged.size(), dropped.size(), threshold);
            }
            return purged.size();
        } finally {
            lock.unlock();
        }
    }

    // -------------------------------------------------------------- internals

    private Optional<String> denyReason(String userId, int incoming) {
        Optional<String> denied = admission.check(userId);
        if (denied.isPresent()) return denied;
        if (queue.size() + incoming > config.maxQueueSize()) {
            return Optional.of("queue is full (" + config.maxQueueSize() + ")");
        }
        return Optional.empty();
    }

    private void cancelLocked(Task t, Instant now, Changes changes) {
        if (t.status() == Task.Status.QUEUED) {
            queue.remove(t.id());
        } else {
            releaseHold(t, false);
        }
        Task c = t.cancelled(now);
        tasks.put(c);
        changes.task(TaskEvent.Type.CANCELLED, c, now);
        settleBatch(c, now, changes);
        log.debug("task {} -> CANCELLED (was {})", t.id(), t.status());
    }

    /** PROCESSING 태스크가 쥐고 있던 lease / 입장 슬롯 / 워커 배정 해제 */
    private void releaseHold(Task processing, boolean processed) {
        leases.release(processing.id());
        admission.release(processing.id());
        workers.release(processing.workerId(), processing.id(), processed);
    }

    /**
     * 멤버 태스크가 종료된 뒤 배치 반영.
     * COMPLETED/FAILED 는 카운터에 더하고, 멤버가 모두 종료됐는데 카운터가 total 에 못 미치면 (개별 취소) CANCELLED.
     */
    private void settleBatch(Task done, Instant now, Changes changes) {
        String batchId = done.batchId();
        if (batchId == null || !batches.isMember(batchId, done.id())) return;
        Batch before = batches.get(batchId).orElse(null);
        if (before == null || before.terminal()) return;

        Batch after = before;
        if (done.status() == Task.Status.COMPLETED || done.status() == Task.Status.FAILED) {
            after = batches.recordOutcome(batchId, done.status() == Task.Status.COMPLETED, now).orElse(before);
        }
        if (!after.terminal() && allMembersTerminal(after)) {
            after = batches.cancel(batchId, now).orElse(after);
        }
        if (after.terminal()) {
            changes.batchFinished(after);
            log.info("batch {} finished: {} (completed={}, failed={}, total={})",
                    batchId, after.status(), after.completedTasks(), after.failedTasks(), after.totalTasks());
        }
    }

    private boolean allMembersTerminal(Batch b) {
        for (String id : b.taskIds()) {
            Optional<Task> t = tasks.get(id);
            if (t.isPresent() && !t.get().terminal()) return false;
        }
        return true;
    }

    private void rollback(List<Task> created) {
        for (Task t : created) {
            queue.remove(t.id());
            tasks.remove(t.id());
        }
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /** 락을 쥔 채 전이를 쌓고(확정 순서 보존), 락을 푼 뒤 전달 */
    private void unlockAndPublish(Changes changes) {
        try {
            changes.stage();
        } finally {
            lock.unlock();
        }
        publisher.drain();
    }

    private final class Changes {
        private final List<TaskEvent> events = new ArrayList<>();
        private final List<Batch> finished = new ArrayList<>();

        void task(TaskEvent.Type type, Task task, Instant at) {
            events.add(new TaskEvent(type, task, at));
        }

        void batchFinished(Batch b) {
            finished.add(b);
        }

        void stage() {
            publisher.stage(events, finished);
        }
    }
}

package net.batchq.core.queue;

import net.batchq.core.model.WorkerInfo;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkerRegistryTest {
    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    @Test
    void heartbeat_sets_busy_or_idle() {
        WorkerRegistry reg = new WorkerRegistry();
        reg.register("w1", "analysis", T0);

        assertTrue(reg.heartbeat("w1", "t1", T0.plusSeconds(5)));
        WorkerInfo w = reg.get("w1").orElseThrow();
        assertEquals(WorkerInfo.Status.BUSY, w.status());
        assertEquals("t1", w.currentTaskId());
        assertEquals(T0.plusSeconds(5), w.lastHeartbeat());

        reg.heartbeat("w1", null, T0.plusSeconds(6));
        assertEquals(WorkerInfo.Status.IDLE, reg.get("w1").orElseThrow().status());

        assertFalse(reg.heartbeat("ghost", null, T0), "미등록 워커");
    }

    @Test
    void release_counts_processed_tasks() {
        WorkerRegistry reg = new WorkerRegistry();
        reg.register("w1", "analysis", T0);
        reg.assign("w1", "t1");
        reg.release("w1", "t1", true);
        reg.assign("w1", "t2");
        reg.release("w1", "t2", false);

        WorkerInfo w = reg.get("w1").orElseThrow();
        assertEquals(1, w.tasksProcessed());
        assertNull(w.currentTaskId());
    }

    @Test
    void removeStale_drops_silent_workers() {
        WorkerRegistry reg = new WorkerRegistry();
        reg.register("w1", "analysis", T0);
        reg.register("w2", "analysis", T0);
        reg.heartbeat("w2", null, T0.plusSeconds(100));

        List<WorkerInfo> removed = reg.removeStale(T0.plusSeconds(50));
        assertEquals(List.of("w1"), removed.stream().map(WorkerInfo::id).toList());
        assertEquals(List.of("w2"), reg.list().stream().map(WorkerInfo::id).toList());
        assertTrue(reg.unregister("w2"));
        assertEquals(0, reg.size());
    }
}

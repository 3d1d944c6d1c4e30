package net.batchq.integration.spring;

import net.batchq.core.maintenance.MaintenanceService;
import net.batchq.core.model.Task;
import net.batchq.core.model.TaskPriority;
import net.batchq.core.service.SchedulerConfig;
import net.batchq.core.service.TaskScheduler;
import net.batchq.core.spi.Clock;
import net.batchq.integration.spring.sched.BatchqSchedulers;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class BatchqSchedulersTest {

    @Test
    void sweep_and_maintenance_delegate_to_core() {
        AtomicReference<Instant> now = new AtomicReference<>(Instant.parse("2024-03-01T09:00:00Z"));
        Clock clock = now::get;
        TaskScheduler scheduler = new TaskScheduler(
                SchedulerConfig.defaults().withVisibilityTimeout(Duration.ofSeconds(5)), clock);
        BatchqSchedulers s = new BatchqSchedulers(scheduler, new MaintenanceService(scheduler, clock, Duration.ofMinutes(2)));

        String id = scheduler.enqueue("u1", "AAPL", Map.of(), TaskPriority.NORMAL).value();
        scheduler.dequeue("w1");
        now.set(now.get().plusSeconds(6));

        assertEquals(1, s.sweep().requeued().size());
        assertEquals(Task.Status.QUEUED, scheduler.getTask(id).orElseThrow().status());
        assertFalse(s.maintenance().hasWork());
    }
}

package net.batchq.integration.spring.sched;

import net.batchq.core.maintenance.MaintenanceService;
import net.batchq.core.service.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;

/** 주기 작업: lease 회수는 짧게, 정리 작업은 길게 */
public class BatchqSchedulers {
    private final TaskScheduler scheduler;
    private final MaintenanceService maintenance;

    public BatchqSchedulers(TaskScheduler scheduler, MaintenanceService maintenance) {
        this.scheduler = scheduler;
        this.maintenance = maintenance;
    }

    @Scheduled(fixedDelayString = "${batchq.scheduler.sweep-delay-ms:5000}")
    public TaskScheduler.SweepResult sweep() {
        return scheduler.recoverExpiredLeases();
    }

    @Scheduled(fixedDelayString = "${batchq.scheduler.maintenance-delay-ms:60000}",
               initialDelayString = "${batchq.scheduler.maintenance-delay-ms:60000}")
    public MaintenanceService.MaintenanceReport maintenance() {
        return maintenance.runOnce();
    }
}

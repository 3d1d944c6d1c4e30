package net.batchq.app;

import net.batchq.core.model.Batch;
import net.batchq.core.model.BatchCreated;
import net.batchq.core.model.Task;
import net.batchq.core.model.TaskPriority;
import net.batchq.core.model.TaskResult;
import net.batchq.core.service.TaskHistoryService;
import net.batchq.core.service.TaskScheduler;
import net.batchq.core.spi.AnalysisEngine;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:batchq-app;MODE=PostgreSQL;DB_CLOSE_DELAY=-1",
        "spring.flyway.locations=classpath:db/migration/batchq",
        "batchq.persistence.enabled=true",
        "batchq.worker.enabled=true",
        "batchq.worker.threads=2",
        "batchq.worker.poll-interval=50ms",
        "batchq.scheduler.sweep-delay-ms=500"
})
class SchedulingFlowTest {

    @TestConfiguration
    static class EngineConfig {
        // "FAIL" 로 시작하는 심볼은 분석 실패
        @Bean
        AnalysisEngine fakeEngine() {
            return task -> {
                if (task.symbol().startsWith("FAIL")) {
                    throw new IllegalArgumentException("no data for " + task.symbol());
                }
                return TaskResult.of(Map.of("symbol", task.symbol(), "score", task.symbol().length()));
            };
        }
    }

    @Autowired TaskScheduler scheduler;
    @Autowired TaskHistoryService history;
    @Autowired JdbcTemplate jdbc;

    @Test
    void batch_is_processed_by_workers_and_archived() throws Exception {
        BatchCreated bc = scheduler.createBatch("u-ok", List.of("AAPL", "MSFT", "GOOG"), Map.of("window", 20),
                TaskPriority.HIGH).value();

        // 1) 워커가 전부 처리
        Awaitility.await().atMost(Duration.ofSeconds(10))
                .until(() -> scheduler.getBatch(bc.batchId()).orElseThrow().status() == Batch.Status.COMPLETED);

        Batch batch = scheduler.getBatch(bc.batchId()).orElseThrow();
        assertThat(batch.completedTasks()).isEqualTo(3);
        assertThat(batch.failedTasks()).isZero();

        Task first = scheduler.getTask(bc.taskIds().get(0)).orElseThrow();
        assertThat(first.result().data()).containsEntry("symbol", "AAPL");
        assertThat(first.result().durationMs()).isNotNull();

        // 2) 아카이브 미러는 비동기: 최종 상태까지 도달
        Awaitility.await().atMost(Duration.ofSeconds(5))
                .until(() -> history.batchMembers(bc.batchId()).stream()
                        .allMatch(t -> t.status() == Task.Status.COMPLETED)
                        && history.batchMembers(bc.batchId()).size() == 3);

        Task archived = history.find(bc.taskIds().get(1)).orElseThrow();
        assertThat(archived.parameters()).containsEntry("window", 20);
        assertThat(archived.priority()).isEqualTo(TaskPriority.HIGH);

        Integer rows = jdbc.queryForObject(
                "SELECT COUNT(*) FROM BQ_TASK_ARCHIVE WHERE BATCH_ID = ?", Integer.class, bc.batchId());
        assertThat(rows).isEqualTo(3);
    }

    @Test
    void failing_member_marks_batch_failed() {
        BatchCreated bc = scheduler.createBatch("u-fail", List.of("IBM", "FAIL1"), Map.of(), TaskPriority.NORMAL).value();

        Awaitility.await().atMost(Duration.ofSeconds(10))
                .until(() -> scheduler.getBatch(bc.batchId()).orElseThrow().status().terminal());

        Batch batch = scheduler.getBatch(bc.batchId()).orElseThrow();
        assertThat(batch.status()).isEqualTo(Batch.Status.FAILED);
        assertThat(batch.completedTasks()).isEqualTo(1);
        assertThat(batch.failedTasks()).isEqualTo(1);

        Task failed = scheduler.getTask(bc.taskIds().get(1)).orElseThrow();
        assertThat(failed.status()).isEqualTo(Task.Status.FAILED);
        assertThat(failed.error()).isEqualTo("no data for FAIL1");

        // 슬롯은 모두 반납
        assertThat(scheduler.getUserQueueStatus("u-fail").processing()).isZero();
    }

    @Test
    void workers_are_registered_while_running() {
        assertThat(scheduler.listWorkers()).hasSizeGreaterThanOrEqualTo(2);
        assertThat(scheduler.listWorkers()).allMatch(w -> w.type().equals("analysis"));
    }
}

package net.batchq.integration.spring;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.batchq.adapter.jdbc.TxContext;
import net.batchq.adapter.jdbc.repo.JdbcTaskArchive;
import net.batchq.core.model.Task;
import net.batchq.core.model.TaskPriority;
import net.batchq.integration.spring.tx.SpringTxRunner;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SpringTxRunnerTest {

    HikariDataSource ds;
    DataSourceTransactionManager tm;
    SpringTxRunner tx;
    JdbcTaskArchive archive = new JdbcTaskArchive();
    Instant t0 = Instant.parse("2024-03-01T09:00:00Z");

    @BeforeAll
    void setupDb() {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl("jdbc:h2:mem:spring-tx;MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        cfg.setUsername("sa");
        cfg.setPassword("");
        cfg.setMaximumPoolSize(4);
        ds = new HikariDataSource(cfg);
        Flyway.configure().dataSource(ds).locations("classpath:db/migration/batchq").load().migrate();
        tm = new DataSourceTransactionManager(ds);
        tx = new SpringTxRunner(tm, ds);
    }

    @AfterAll
    void cleanup() {
        ds.close();
    }

    @BeforeEach
    void truncate() throws Exception {
        tx.execute(() -> {
            try (var st = TxContext.require().createStatement()) {
                st.execute("DELETE FROM BQ_TASK_ARCHIVE");
            }
        });
    }

    private Task task(String id) {
        return Task.queued(id, "u1", "AAPL", Map.of(), TaskPriority.NORMAL, null, t0);
    }

    @Test
    void commits_and_clears_context() throws Exception {
        tx.execute(() -> archive.save(task("s-1")));
        assertNull(TxContext.current());
        assertTrue(tx.required(() -> archive.load("s-1")).isPresent());
    }

    @Test
    void runtime_exception_rolls_back_and_propagates() throws Exception {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> tx.required(() -> {
            archive.save(task("s-2"));
            throw new IllegalArgumentException("bad");
        }));
        assertEquals("bad", e.getMessage());
        assertTrue(tx.required(() -> archive.load("s-2")).isEmpty());
    }

    @Test
    void checked_exception_is_wrapped_and_rolled_back() throws Exception {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> tx.required(() -> {
            archive.save(task("s-3"));
            throw new java.io.IOException("disk");
        }));
        assertInstanceOf(java.io.IOException.class, e.getCause());
        assertTrue(tx.required(() -> archive.load("s-3")).isEmpty());
    }

    @Test
    void joins_surrounding_spring_transaction() throws Exception {
        TransactionTemplate outer = new TransactionTemplate(tm);
        outer.executeWithoutResult(status -> {
            try {
                tx.execute(() -> archive.save(task("s-4")));
            } catch (Exception ex) {
                throw new IllegalStateException(ex);
            }
            status.setRollbackOnly();
        });
        assertTrue(tx.required(() -> archive.load("s-4")).isEmpty(), "바깥 트랜잭션 롤백에 함께 묶인다");
    }
}

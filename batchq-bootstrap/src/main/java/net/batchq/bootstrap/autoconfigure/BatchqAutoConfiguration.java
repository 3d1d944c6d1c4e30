package net.batchq.bootstrap.autoconfigure;

import net.batchq.bootstrap.props.BatchqProperties;
import net.batchq.core.maintenance.MaintenanceService;
import net.batchq.core.service.SchedulerConfig;
import net.batchq.core.service.TaskEventPublisher;
import net.batchq.core.service.TaskScheduler;
import net.batchq.core.spi.AnalysisEngine;
import net.batchq.core.spi.Clock;
import net.batchq.core.spi.TaskEventListener;
import net.batchq.core.worker.TaskWorkerPool;
import net.batchq.integration.spring.BatchqSpringConfig;
import net.batchq.integration.spring.sched.BatchqSchedulers;
import net.batchq.integration.spring.worker.WorkerPoolLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.stream.Collectors;

@AutoConfiguration(after = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@EnableConfigurationProperties(BatchqProperties.class)
public class BatchqAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(BatchqAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean
    public Clock batchqClock() {
        return Clock.system();
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerConfig schedulerConfig(BatchqProperties props) {
        return props.toSchedulerConfig();
    }

    // 리스너(아카이브 미러 포함)는 전용 스레드에서 확정 순서대로. close()는 스프링이 종료 시 호출
    @Bean
    @ConditionalOnMissingBean
    public TaskEventPublisher taskEventPublisher(ObjectProvider<TaskEventListener> listeners, BatchqProperties props) {
        var list = listeners.orderedStream().collect(Collectors.toList());
        int backlog = props.getEvents().getBacklogCapacity();
        log.info("[batchq] task event listeners: {} (backlog {})", list.stream()
                .map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")), backlog);
        return TaskEventPublisher.async(list, "batchq-events", backlog);
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public TaskScheduler taskScheduler(SchedulerConfig config, Clock clock, TaskEventPublisher publisher) {
        log.info("[batchq] scheduler limits: user={} global={} visibility={} maxQueue={}",
                config.userConcurrentLimit(), config.globalConcurrentLimit(),
                config.visibilityTimeout(), config.maxQueueSize());
        return new TaskScheduler(config, clock, publisher);
    }

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceService maintenanceService(TaskScheduler scheduler, Clock clock, BatchqProperties props) {
        return new MaintenanceService(scheduler, clock, props.getScheduler().getWorkerHeartbeatTimeout());
    }

    // --- 주기 작업 (딜레이는 batchq.scheduler.*-delay-ms) ---

    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @ConditionalOnProperty(prefix = "batchq.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class SchedulingConfig {
        @Bean
        @ConditionalOnMissingBean
        public BatchqSchedulers batchqSchedulers(TaskScheduler scheduler, MaintenanceService maintenance) {
            return new BatchqSchedulers(scheduler, maintenance);
        }
    }

    // --- JDBC 아카이브 (DataSource + 트랜잭션 매니저 필요) ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "batchq.persistence", name = "enabled", havingValue = "true")
    @Import(BatchqSpringConfig.class)
    static class PersistenceConfig {
    }

    // --- 프로세스 내 워커 (AnalysisEngine 빈이 있을 때만) ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "batchq.worker", name = "enabled", havingValue = "true")
    @ConditionalOnBean(AnalysisEngine.class)
    static class WorkerConfig {
        @Bean
        @ConditionalOnMissingBean
        public TaskWorkerPool taskWorkerPool(TaskScheduler scheduler, AnalysisEngine engine, BatchqProperties props) {
            var w = props.getWorker();
            return new TaskWorkerPool(scheduler, engine, w.getType(), w.getThreads(), w.getPollInterval());
        }

        @Bean
        public WorkerPoolLifecycle workerPoolLifecycle(TaskWorkerPool pool) {
            return new WorkerPoolLifecycle(pool);
        }
    }
}

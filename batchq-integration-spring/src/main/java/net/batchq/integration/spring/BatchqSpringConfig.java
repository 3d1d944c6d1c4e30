package net.batchq.integration.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.batchq.adapter.jdbc.repo.JdbcTaskArchive;
import net.batchq.core.service.TaskArchiveMirror;
import net.batchq.core.service.TaskHistoryService;
import net.batchq.core.spi.TaskArchive;
import net.batchq.core.spi.TxRunner;
import net.batchq.integration.spring.tx.SpringTxRunner;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/** 영속화 배선: 아카이브 + 미러 + 이력 조회 (adapter-jdbc 재사용) */
@Configuration(proxyBeanMethods = false)
public class BatchqSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean
    public TaskArchive taskArchive(ObjectProvider<ObjectMapper> objectMapper) {
        return new JdbcTaskArchive(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    // 모든 전이를 아카이브로 (TaskEventListener 로 수집됨)
    @Bean
    public TaskArchiveMirror taskArchiveMirror(TaskArchive archive, TxRunner tx) {
        return new TaskArchiveMirror(archive, tx);
    }

    @Bean
    public TaskHistoryService taskHistoryService(TaskArchive archive, TxRunner tx) {
        return new TaskHistoryService(archive, tx);
    }
}

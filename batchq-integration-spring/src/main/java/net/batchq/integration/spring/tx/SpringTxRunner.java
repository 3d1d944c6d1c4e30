package net.batchq.integration.spring.tx;

import net.batchq.adapter.jdbc.TxContext;
import net.batchq.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/** 스프링 트랜잭션 위에서 TxContext 를 채워 JDBC 어댑터를 그대로 재사용 */
public final class SpringTxRunner implements TxRunner {
    private final TransactionTemplate template;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.template = new TransactionTemplate(tm);
        this.template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) {
        return template.execute(status -> {
            // 이미 TxContext가 있다면 그대로 사용 (중첩 호출)
            if (TxContext.active()) {
                return call(body);
            }
            // 스프링 트랜잭션의 물리 커넥션을 끌어와 TxContext에 꽂아줌
            Connection con = DataSourceUtils.getConnection(ds);
            try {
                TxContext.bind(con);
                return call(body);
            } finally {
                TxContext.unbind();
                DataSourceUtils.releaseConnection(con, ds);
            }
        });
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }
}

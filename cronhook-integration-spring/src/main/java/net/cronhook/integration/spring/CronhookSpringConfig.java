package net.cronhook.integration.spring;

import net.cronhook.adapter.jdbc.repo.JdbcExecutionLogRepository;
import net.cronhook.adapter.jdbc.repo.JdbcJobRepository;
import net.cronhook.core.spi.Clock;
import net.cronhook.core.spi.ExecutionLogRepository;
import net.cronhook.core.spi.JobRepository;
import net.cronhook.core.spi.TxRunner;
import net.cronhook.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/** 앱의 DataSource/트랜잭션 위에 JDBC 저장소 배선 */
@Configuration(proxyBeanMethods = false)
public class CronhookSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean public JobRepository jobRepository() { return new JdbcJobRepository(); }
    @Bean public ExecutionLogRepository executionLogRepository(TxRunner tx) { return new JdbcExecutionLogRepository(tx); }

    @Bean public Clock systemClock() { return Clock.system(); }
}

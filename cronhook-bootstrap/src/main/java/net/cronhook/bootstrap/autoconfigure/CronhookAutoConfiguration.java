package net.cronhook.bootstrap.autoconfigure;

import net.cronhook.adapter.http.OkHttpExecutionRunner;
import net.cronhook.bootstrap.catalog.CatalogRegistrar;
import net.cronhook.bootstrap.props.CronhookProperties;
import net.cronhook.core.maintenance.LogRetentionService;
import net.cronhook.core.registry.TimerRegistry;
import net.cronhook.core.schedule.ScheduleParser;
import net.cronhook.core.service.JobManagementService;
import net.cronhook.core.service.Reconciler;
import net.cronhook.core.spi.Clock;
import net.cronhook.core.spi.ExecutionLogRepository;
import net.cronhook.core.spi.ExecutionRunner;
import net.cronhook.core.spi.JobRepository;
import net.cronhook.core.spi.TxRunner;
import net.cronhook.integration.spring.CronhookSpringConfig;
import net.cronhook.integration.spring.sched.CronhookSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.ZoneId;

@AutoConfiguration(after = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@EnableConfigurationProperties(CronhookProperties.class)
@Import(CronhookSpringConfig.class) // integration-spring: repo/tx/clock 배선
public class CronhookAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(CronhookAutoConfiguration.class);

    // --- 스케줄 + 타이머 ---

    @Bean
    @ConditionalOnMissingBean
    public ScheduleParser scheduleParser(CronhookProperties props) {
        return new ScheduleParser(ZoneId.of(props.getZone()), props.getScheduler().getHorizonYears());
    }

    @Bean
    public CronhookExecutors cronhookExecutors() {
        return new CronhookExecutors();
    }

    @Bean
    @ConditionalOnMissingBean
    public TimerRegistry timerRegistry(ScheduleParser parser, Clock clock, CronhookExecutors executors) {
        return new TimerRegistry(parser, clock, executors.timers(), executors.workers());
    }

    @Bean
    @ConditionalOnMissingBean(ExecutionRunner.class)
    public OkHttpExecutionRunner executionRunner(CronhookProperties props) {
        var runner = props.getRunner();
        return OkHttpExecutionRunner.create(runner.getTimeout(), runner.isFailOnHttpError());
    }

    // --- core 서비스 ---

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public Reconciler reconciler(TimerRegistry registry,
                                 ScheduleParser parser,
                                 ExecutionRunner runner,
                                 ExecutionLogRepository logs,
                                 Clock clock) {
        return new Reconciler(registry, parser, runner, logs, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobManagementService jobManagement(JobRepository jobs,
                                              ExecutionLogRepository logs,
                                              Reconciler reconciler,
                                              ScheduleParser parser,
                                              TxRunner tx,
                                              Clock clock) {
        return new JobManagementService(jobs, logs, reconciler, parser, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public LogRetentionService logRetention(ExecutionLogRepository logs, TxRunner tx, Clock clock) {
        return new LogRetentionService(logs, tx, clock);
    }

    // --- 정리 작업 (주기는 cronhook.retention.initial-delay-ms / interval-ms) ---

    @Bean
    @ConditionalOnProperty(prefix = "cronhook.retention", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CronhookSchedulers cronhookSchedulers(LogRetentionService retention, CronhookProperties props) {
        var s = new CronhookSchedulers(retention);
        s.setMaxAge(props.getRetention().getMaxAge());
        return s;
    }

    // --- 기동 ---

    @Bean
    public CatalogRegistrar catalogRegistrar(JobManagementService jobs) {
        return new CatalogRegistrar(jobs);
    }

    /** 저장된 잡 먼저 등록, 카탈로그는 일반 create/update 경로로 반영 */
    @Bean
    public ApplicationRunner cronhookStartupRunner(JobManagementService jobs,
                                                   CatalogRegistrar registrar,
                                                   CronhookProperties props) {
        return args -> {
            if (props.getScheduler().isInitializeOnStartup()) {
                jobs.initialize();
            }
            var catalog = props.getCatalog();
            if (catalog.isEnabled() && !catalog.getJobs().isEmpty()) {
                log.info("Cronhook catalog: {}", catalog.getJobs());
                registrar.register(catalog);
            }
        };
    }
}

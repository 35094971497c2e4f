package net.cronhook.integration.spring.sched;

import net.cronhook.core.maintenance.LogRetentionService;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

/** 주기 정리 작업 (잡 타이머는 스프링이 아니라 core 레지스트리가 구동) */
public class CronhookSchedulers {
    private final LogRetentionService retention;

    private Duration maxAge = LogRetentionService.DEFAULT_RETENTION;

    public CronhookSchedulers(LogRetentionService retention) {
        this.retention = retention;
    }

    @Scheduled(initialDelayString = "${cronhook.retention.initial-delay-ms:60000}",
               fixedDelayString = "${cronhook.retention.interval-ms:3600000}")
    public void purgeExecutionLogs() throws Exception {
        retention.purgeOlderThan(maxAge);
    }

    public Duration getMaxAge() {
        return maxAge;
    }

    public void setMaxAge(Duration maxAge) {
        this.maxAge = maxAge;
    }
}

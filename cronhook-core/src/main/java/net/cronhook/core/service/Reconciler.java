package net.cronhook.core.service;

import net.cronhook.core.model.ExecutionOutcome;
import net.cronhook.core.model.ExecutionRecord;
import net.cronhook.core.model.JobDefinition;
import net.cronhook.core.model.JobField;
import net.cronhook.core.registry.TimerRegistry;
import net.cronhook.core.schedule.CronSchedule;
import net.cronhook.core.schedule.ScheduleException;
import net.cronhook.core.schedule.ScheduleParser;
import net.cronhook.core.spi.Clock;
import net.cronhook.core.spi.ExecutionRunner;
import net.cronhook.core.spi.LogSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Set;

/**
 * Entry point used by the management layer to keep running timers in line with stored jobs.
 * Schedules handed in here are expected to have been validated already.
 */
public final class Reconciler {
    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final TimerRegistry registry;
    private final ScheduleParser parser;
    private final ExecutionRunner runner;
    private final LogSink sink;
    private final Clock clock;

    public Reconciler(TimerRegistry registry, ScheduleParser parser, ExecutionRunner runner, LogSink sink, Clock clock) {
        this.registry = registry;
        this.parser = parser;
        this.runner = runner;
        this.sink = sink;
        this.clock = clock;
    }

    /** @throws ScheduleException if the schedule was not validated before the job was stored */
    public void onJobCreated(JobDefinition job) {
        if (job.active()) {
            schedule(job);
        }
    }

    public void onJobUpdated(JobDefinition job, Set<JobField> changedFields) {
        if (changedFields.isEmpty()) {
            return;
        }
        if (job.active()) {
            schedule(job);
        } else if (registry.remove(job.id())) {
            log.info("Job {} deactivated, timer stopped", job.id());
        }
    }

    public void onJobDeleted(String jobId) {
        if (registry.remove(jobId)) {
            log.info("Job {} deleted, timer stopped", jobId);
        }
    }

    /** Schedules every active job; returns how many timers were installed. */
    public int onStartup(Collection<JobDefinition> jobs) {
        int scheduled = 0;
        for (JobDefinition job : jobs) {
            if (!job.active()) continue;
            try {
                schedule(job);
                scheduled++;
            } catch (ScheduleException e) {
                log.error("Skipping job {} at startup: {}", job.id(), e.getMessage());
            }
        }
        log.info("Initialized {} active cron jobs", scheduled);
        return scheduled;
    }

    public boolean isScheduled(String jobId) {
        return registry.isScheduled(jobId);
    }

    /** 현재 걸려 있는 타이머 수 */
    public int scheduledCount() {
        return registry.size();
    }

    public void shutdown() {
        registry.removeAll();
    }

    private void schedule(JobDefinition job) {
        CronSchedule schedule = parser.parse(job.schedule());
        // 타이머는 정의 사본을 들고 있음, 갱신 시 타이머 통째로 교체
        registry.upsert(job.id(), schedule, (jobId, fireTime) -> fire(job, fireTime));
    }

    void fire(JobDefinition job, Instant fireTime) {
        Instant started = clock.now();
        ExecutionOutcome outcome;
        try {
            outcome = runner.execute(job.url(), job.body(), job.secret());
        } catch (RuntimeException e) {
            // runner가 계약을 어겨도 발화당 기록 1건
            outcome = ExecutionOutcome.transportFailure(
                    Duration.between(started, clock.now()).toMillis(), e.toString());
        }
        ExecutionRecord record = ExecutionRecord.of(job.id(), outcome, clock.now());

        if (outcome.succeeded()) {
            log.info("Job {} executed: {} ({}ms)", job.id(), outcome.responseCode(), outcome.durationMs());
        } else {
            log.warn("Job {} failed after {}ms: {}", job.id(), outcome.durationMs(), outcome.errorMessage());
        }

        try {
            sink.record(record);
        } catch (Exception e) {
            log.warn("Could not record execution of job {} (fired {}): {}", job.id(), fireTime, e.toString());
        }
    }
}

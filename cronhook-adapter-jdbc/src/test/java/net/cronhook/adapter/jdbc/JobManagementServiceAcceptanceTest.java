package net.cronhook.adapter.jdbc;

import net.cronhook.adapter.jdbc.repo.JdbcExecutionLogRepository;
import net.cronhook.adapter.jdbc.repo.JdbcJobRepository;
import net.cronhook.core.maintenance.LogRetentionService;
import net.cronhook.core.model.ExecutionOutcome;
import net.cronhook.core.model.ExecutionRecord;
import net.cronhook.core.model.JobDefinition;
import net.cronhook.core.model.JobPatch;
import net.cronhook.core.registry.TimerRegistry;
import net.cronhook.core.schedule.ScheduleParser;
import net.cronhook.core.service.InvalidJobException;
import net.cronhook.core.service.JobAlreadyExistsException;
import net.cronhook.core.service.JobManagementService;
import net.cronhook.core.service.Reconciler;
import net.cronhook.core.spi.Clock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/** Management operations end to end over the JDBC repositories. */
class JobManagementServiceAcceptanceTest extends TestSupport {

    final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    final Clock clock = () -> now;

    ScheduledExecutorService timerService;
    ExecutorService workers;
    TimerRegistry registry;
    JdbcExecutionLogRepository logs;
    JobManagementService svc;

    @BeforeEach
    void setUp() throws Exception {
        truncateAll();
        var parser = new ScheduleParser();
        timerService = Executors.newSingleThreadScheduledExecutor();
        workers = Executors.newFixedThreadPool(2);
        registry = new TimerRegistry(parser, clock, timerService, workers);
        logs = new JdbcExecutionLogRepository(tx);
        var reconciler = new Reconciler(registry, parser,
                (url, body, secret) -> ExecutionOutcome.responded(200, 3), logs, clock);
        svc = new JobManagementService(new JdbcJobRepository(), logs, reconciler, parser, tx, clock);
    }

    @AfterEach
    void tearDown() {
        registry.close();
        timerService.shutdownNow();
        workers.shutdownNow();
    }

    private static JobDefinition yearly(String id, boolean active) {
        return JobDefinition.ofNew(id, "https://hooks.example.test/" + id, "0 0 1 1 *", "{}", "secret", active);
    }

    @Test
    void createUpdateDelete_keepRowsAndTimersInStep() throws Exception {
        svc.create(yearly("a", true));
        svc.create(yearly("b", false));
        assertThatThrownBy(() -> svc.create(yearly("a", false))).isInstanceOf(JobAlreadyExistsException.class);

        assertTrue(svc.isScheduled("a"));
        assertFalse(svc.isScheduled("b"));

        svc.update("b", JobPatch.empty().active(true).clearSecret());
        assertTrue(svc.isScheduled("b"));
        assertNull(svc.get("b").secret());

        svc.update("a", JobPatch.empty().active(false));
        assertFalse(svc.isScheduled("a"));

        svc.delete("b");
        assertFalse(svc.isScheduled("b"));
        assertEquals(1, svc.list().size());
    }

    @Test
    void initialize_schedulesStoredActiveJobs() throws Exception {
        var jobs = new JdbcJobRepository();
        tx.required(() -> {
            jobs.insert(yearly("x", true));
            jobs.insert(yearly("y", true));
            jobs.insert(yearly("z", false));
            return null;
        });

        assertEquals(2, svc.initialize());
        assertEquals(2, registry.size());
    }

    @Test
    void overlongUrl_isRejectedBeforeReachingTheDatabase() throws Exception {
        String url = "https://hooks.example.test/" + "x".repeat(2048);
        assertThrows(InvalidJobException.class,
                () -> svc.create(JobDefinition.ofNew("long", url, "0 0 1 1 *", null, null, true)));
        assertTrue(svc.list().isEmpty());
    }

    @Test
    void statsAndRetention_readTheLogTable() throws Exception {
        svc.create(yearly("a", true));
        logs.record(ExecutionRecord.of("a", ExecutionOutcome.responded(200, 10), now));
        logs.record(ExecutionRecord.of("a", ExecutionOutcome.transportFailure(10, "refused"), now));
        logs.record(ExecutionRecord.of("a", ExecutionOutcome.responded(200, 10), now.minus(Duration.ofDays(40))));

        var stats = svc.stats();
        assertEquals(1, stats.totalJobs());
        assertEquals(1, stats.activeJobs());
        assertEquals(2, stats.executionsToday());
        assertEquals(50.0, stats.successRate());

        var health = svc.health();
        assertEquals(1, health.activeJobs());
        assertEquals(1, health.scheduledTimers());

        var report = new LogRetentionService(logs, tx, clock).purgeOlderThanDays(30);
        assertEquals(1, report.deletedLogs());
        assertEquals(2, svc.logs("a", 0).size());
    }
}

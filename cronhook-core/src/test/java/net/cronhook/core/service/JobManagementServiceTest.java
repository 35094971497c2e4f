package net.cronhook.core.service;

import net.cronhook.core.MutableClock;
import net.cronhook.core.model.ExecutionOutcome;
import net.cronhook.core.model.ExecutionRecord;
import net.cronhook.core.model.ExecutionStatus;
import net.cronhook.core.model.HealthStatus;
import net.cronhook.core.model.JobDefinition;
import net.cronhook.core.model.JobPatch;
import net.cronhook.core.registry.TimerRegistry;
import net.cronhook.core.schedule.InvalidScheduleException;
import net.cronhook.core.schedule.ScheduleParser;
import net.cronhook.core.schedule.UnreachableScheduleException;
import net.cronhook.core.spi.TxRunner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class JobManagementServiceTest {

    static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");

    MutableClock clock;
    InMemoryJobRepository jobs;
    InMemoryExecutionLogRepository logs;
    ScheduledExecutorService timerService;
    ExecutorService workers;
    TimerRegistry registry;
    JobManagementService svc;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        jobs = new InMemoryJobRepository(NOW);
        logs = new InMemoryExecutionLogRepository();
        var parser = new ScheduleParser();
        timerService = Executors.newSingleThreadScheduledExecutor();
        workers = Executors.newFixedThreadPool(2);
        registry = new TimerRegistry(parser, clock, timerService, workers);
        var reconciler = new Reconciler(registry, parser,
                (url, body, secret) -> ExecutionOutcome.responded(200, 1), logs, clock);
        svc = new JobManagementService(jobs, logs, reconciler, parser, TxRunner.direct(), clock);
    }

    @AfterEach
    void tearDown() {
        registry.close();
        timerService.shutdownNow();
        workers.shutdownNow();
    }

    private static JobDefinition job(String id, String schedule, boolean active) {
        return JobDefinition.ofNew(id, "https://hooks.example.test/" + id, schedule, null, null, active);
    }

    @Test
    void create_storesAndSchedulesActiveJob() throws Exception {
        var stored = svc.create(JobDefinition.ofNew("nightly-report", "https://hooks.example.test/report",
                "0 2 * * *", "{\"full\":true}", "token", true));

        assertEquals(NOW, stored.createdAt());
        assertEquals(JobDefinition.DEFAULT_CREATOR, stored.createdBy());
        assertEquals(stored, svc.get("nightly-report"));
        assertTrue(svc.isScheduled("nightly-report"));
        assertEquals(Instant.parse("2024-01-02T02:00:00Z"), registry.nextFireTime("nightly-report").orElseThrow());
    }

    @Test
    void create_inactiveJobIsStoredButNotScheduled() throws Exception {
        svc.create(job("paused", "* * * * *", false));
        assertEquals(1, svc.list().size());
        assertFalse(svc.isScheduled("paused"));
    }

    @Test
    void create_duplicateIdIsRejected() throws Exception {
        svc.create(job("dup", "* * * * *", true));
        assertThatThrownBy(() -> svc.create(job("dup", "*/5 * * * *", true)))
                .isInstanceOf(JobAlreadyExistsException.class)
                .hasMessage("Job with this ID already exists: dup");
        assertEquals("* * * * *", svc.get("dup").schedule());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "has space", "dots.not.allowed", "slash/id", "ünïcode"})
    void create_rejectsBadIds(String id) {
        assertThatThrownBy(() -> svc.create(job(id, "* * * * *", true)))
                .isInstanceOf(InvalidJobException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"ftp://example.test/x", "/relative/path", "example.test/x", "http://", "not a url", "   "})
    void create_rejectsBadUrls(String url) {
        assertThatThrownBy(() -> svc.create(JobDefinition.ofNew("j", url, "* * * * *", null, null, true)))
                .isInstanceOf(InvalidJobException.class);
        assertTrue(jobs.findAll().isEmpty());
    }

    @Test
    void create_rejectsValuesLongerThanTheirColumns() {
        String longUrl = "https://hooks.example.test/" + "a".repeat(JobManagementService.MAX_URL_LENGTH);
        assertThatThrownBy(() -> svc.create(JobDefinition.ofNew("j", longUrl, "* * * * *", null, null, true)))
                .isInstanceOf(InvalidJobException.class)
                .hasMessageContaining("2048");
        String longSchedule = "0" + " ".repeat(JobManagementService.MAX_SCHEDULE_LENGTH) + "* * * *";
        assertThatThrownBy(() -> svc.create(job("j", longSchedule, true)))
                .isInstanceOf(InvalidJobException.class);
        String longSecret = "s".repeat(JobManagementService.MAX_SECRET_LENGTH + 1);
        assertThatThrownBy(() -> svc.create(JobDefinition.ofNew("j", "https://a.test/x", "* * * * *", null, longSecret, true)))
                .isInstanceOf(InvalidJobException.class);
        assertTrue(jobs.findAll().isEmpty());
    }

    @Test
    void create_acceptsUrlAtTheColumnLimit() throws Exception {
        String prefix = "https://hooks.example.test/";
        String url = prefix + "a".repeat(JobManagementService.MAX_URL_LENGTH - prefix.length());
        assertEquals(url, svc.create(JobDefinition.ofNew("j", url, "* * * * *", null, null, true)).url());
    }

    @Test
    void update_rejectsTooLongUrlOrSecretAndKeepsTheRow() throws Exception {
        svc.create(job("j", "0 * * * *", true));
        String longUrl = "https://hooks.example.test/" + "a".repeat(JobManagementService.MAX_URL_LENGTH);

        assertThatThrownBy(() -> svc.update("j", JobPatch.empty().url(longUrl)))
                .isInstanceOf(InvalidJobException.class);
        assertThatThrownBy(() -> svc.update("j", JobPatch.empty().secret("s".repeat(JobManagementService.MAX_SECRET_LENGTH + 1))))
                .isInstanceOf(InvalidJobException.class);

        assertEquals("https://hooks.example.test/j", svc.get("j").url());
        assertNull(svc.get("j").secret());
    }

    @Test
    void create_rejectsBadSchedulesWithoutStoringAnything() {
        assertThatThrownBy(() -> svc.create(job("j", "* * * *", true)))
                .isInstanceOf(InvalidScheduleException.class);
        assertThatThrownBy(() -> svc.create(job("j", "0 0 31 2 *", true)))
                .isInstanceOf(UnreachableScheduleException.class);
        assertTrue(jobs.findAll().isEmpty());
        assertEquals(0, registry.size());
    }

    @Test
    void update_unknownJobIsNotFound() {
        assertThatThrownBy(() -> svc.update("ghost", JobPatch.empty().active(false)))
                .isInstanceOf(JobNotFoundException.class)
                .hasMessage("Job not found: ghost");
    }

    @Test
    void update_deactivateAndReactivate() throws Exception {
        svc.create(job("j", "*/10 * * * *", true));

        var paused = svc.update("j", JobPatch.empty().active(false));
        assertFalse(paused.active());
        assertFalse(svc.isScheduled("j"));
        assertFalse(svc.get("j").active());

        svc.update("j", JobPatch.empty().active(true).schedule("30 * * * *"));
        assertTrue(svc.isScheduled("j"));
        assertEquals(Instant.parse("2024-01-01T10:30:00Z"), registry.nextFireTime("j").orElseThrow());
    }

    @Test
    void update_keepsUnsetFields_andCanClearBodyAndSecret() throws Exception {
        svc.create(JobDefinition.ofNew("j", "https://a.test/x", "0 * * * *", "{}", "secret", true));

        var moved = svc.update("j", JobPatch.empty().url("https://b.test/y"));
        assertEquals("https://b.test/y", moved.url());
        assertEquals("{}", moved.body());
        assertEquals("secret", moved.secret());
        assertEquals("0 * * * *", moved.schedule());

        var cleared = svc.update("j", JobPatch.empty().clearBody().clearSecret());
        assertNull(cleared.body());
        assertNull(cleared.secret());
        assertEquals(cleared, svc.get("j"));
    }

    @Test
    void update_invalidScheduleLeavesJobAndTimerUntouched() throws Exception {
        svc.create(job("j", "0 * * * *", true));
        Instant before = registry.nextFireTime("j").orElseThrow();

        assertThatThrownBy(() -> svc.update("j", JobPatch.empty().schedule("99 * * * *")))
                .isInstanceOf(InvalidScheduleException.class);
        assertThatThrownBy(() -> svc.update("j", JobPatch.empty().url("mailto:x@y.z")))
                .isInstanceOf(InvalidJobException.class);

        assertEquals("0 * * * *", svc.get("j").schedule());
        assertEquals(before, registry.nextFireTime("j").orElseThrow());
    }

    @Test
    void update_withSameValuesChangesNothing() throws Exception {
        var created = svc.create(job("j", "0 * * * *", true));
        var same = svc.update("j", JobPatch.empty().schedule("0 * * * *").active(true));
        assertEquals(created, same);
        assertTrue(svc.isScheduled("j"));
    }

    @Test
    void delete_removesRowAndTimer() throws Exception {
        svc.create(job("j", "* * * * *", true));
        svc.delete("j");

        assertFalse(svc.isScheduled("j"));
        assertThatThrownBy(() -> svc.get("j")).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> svc.delete("j")).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void logs_limitDefaultsAndIsCapped() throws Exception {
        svc.logs(null, 0);
        assertEquals(JobManagementService.DEFAULT_LOG_LIMIT, logs.lastLimit);
        svc.logs("j", 5000);
        assertEquals(JobManagementService.MAX_LOG_LIMIT, logs.lastLimit);
        svc.logs("j", 7);
        assertEquals(7, logs.lastLimit);
    }

    @Test
    void logs_newestFirstAndFilteredByJob() throws Exception {
        logs.record(record("a", "2024-01-01T08:00:00Z", ExecutionStatus.SUCCESS));
        logs.record(record("b", "2024-01-01T08:30:00Z", ExecutionStatus.SUCCESS));
        logs.record(record("a", "2024-01-01T09:00:00Z", ExecutionStatus.ERROR));

        var forA = svc.logs("a", 10);
        assertThat(forA).extracting(ExecutionRecord::timestamp)
                .containsExactly(Instant.parse("2024-01-01T09:00:00Z"), Instant.parse("2024-01-01T08:00:00Z"));
        assertEquals(3, svc.logs(null, 10).size());
        assertEquals(1, svc.logs(null, 1).size());
    }

    @Test
    void stats_countsJobsAndTodaysExecutions() throws Exception {
        svc.create(job("a", "0 * * * *", true));
        svc.create(job("b", "0 * * * *", false));
        logs.record(record("a", "2023-12-31T23:59:00Z", ExecutionStatus.ERROR));   // yesterday
        logs.record(record("a", "2024-01-01T00:00:00Z", ExecutionStatus.SUCCESS));
        logs.record(record("a", "2024-01-01T08:00:00Z", ExecutionStatus.SUCCESS));
        logs.record(record("a", "2024-01-01T09:00:00Z", ExecutionStatus.ERROR));

        var stats = svc.stats();
        assertEquals(2, stats.totalJobs());
        assertEquals(1, stats.activeJobs());
        assertEquals(3, stats.executionsToday());
        assertEquals(66.7, stats.successRate());
    }

    @Test
    void stats_withoutExecutionsReportsFullSuccess() throws Exception {
        var stats = svc.stats();
        assertEquals(0, stats.totalJobs());
        assertEquals(0, stats.executionsToday());
        assertEquals(100.0, stats.successRate());
    }

    @Test
    void health_reportsStoredActiveJobsAndArmedTimers() throws Exception {
        svc.create(job("a", "0 * * * *", true));
        svc.create(job("b", "0 * * * *", false));
        jobs.insert(job("c", "0 * * * *", true));   // stored but not yet armed

        var health = svc.health();
        assertEquals(HealthStatus.HEALTHY, health.status());
        assertEquals(NOW, health.timestamp());
        assertEquals(2, health.activeJobs());
        assertEquals(1, health.scheduledTimers());
        assertThat(health.heapUsedMb()).isPositive();
    }

    @Test
    void initialize_schedulesOnlyActiveStoredJobs() throws Exception {
        jobs.insert(job("a", "0 * * * *", true));
        jobs.insert(job("b", "0 * * * *", false));
        jobs.insert(job("c", "*/2 * * * *", true));

        assertEquals(2, svc.initialize());
        assertTrue(svc.isScheduled("a"));
        assertFalse(svc.isScheduled("b"));
        assertTrue(svc.isScheduled("c"));
    }

    private static ExecutionRecord record(String jobId, String at, ExecutionStatus status) {
        return new ExecutionRecord(UUID.randomUUID().toString(), jobId, Instant.parse(at), status,
                status == ExecutionStatus.SUCCESS ? 200 : null, 10,
                status == ExecutionStatus.SUCCESS ? null : "HTTP 500: Internal Server Error");
    }
}

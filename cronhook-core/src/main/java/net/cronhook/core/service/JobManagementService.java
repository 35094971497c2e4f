package net.cronhook.core.service;

import net.cronhook.core.model.ExecutionRecord;
import net.cronhook.core.model.ExecutionSummary;
import net.cronhook.core.model.HealthStatus;
import net.cronhook.core.model.JobDefinition;
import net.cronhook.core.model.JobField;
import net.cronhook.core.model.JobPatch;
import net.cronhook.core.model.JobStats;
import net.cronhook.core.schedule.ScheduleParser;
import net.cronhook.core.spi.Clock;
import net.cronhook.core.spi.ExecutionLogRepository;
import net.cronhook.core.spi.JobRepository;
import net.cronhook.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates and persists job mutations, then hands them to the {@link Reconciler}. Mutations
 * are serialized so that the order of stored changes and timer changes is the same.
 */
public final class JobManagementService {
    private static final Logger log = LoggerFactory.getLogger(JobManagementService.class);

    public static final int DEFAULT_LOG_LIMIT = 100;
    public static final int MAX_LOG_LIMIT = 1000;

    // V1__init.sql 컬럼 길이와 맞춤
    static final int MAX_URL_LENGTH = 2048;
    static final int MAX_SCHEDULE_LENGTH = 128;
    static final int MAX_SECRET_LENGTH = 1024;

    private static final Pattern JOB_ID = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private final JobRepository jobs;
    private final ExecutionLogRepository logs;
    private final Reconciler reconciler;
    private final ScheduleParser parser;
    private final TxRunner tx;
    private final Clock clock;

    public JobManagementService(JobRepository jobs,
                                ExecutionLogRepository logs,
                                Reconciler reconciler,
                                ScheduleParser parser,
                                TxRunner tx,
                                Clock clock) {
        this.jobs = jobs;
        this.logs = logs;
        this.reconciler = reconciler;
        this.parser = parser;
        this.tx = tx;
        this.clock = clock;
    }

    /** Loads active jobs and installs their timers; returns how many were scheduled. */
    public int initialize() throws Exception {
        List<JobDefinition> active = tx.required(jobs::loadActiveJobs);
        return reconciler.onStartup(active);
    }

    public synchronized JobDefinition create(JobDefinition job) throws Exception {
        validateId(job.id());
        validateUrl(job.url());
        validateScheduleLength(job.schedule());
        validateSecret(job.secret());
        parser.validate(job.schedule(), clock.now());

        JobDefinition stored = tx.required(() -> {
            if (jobs.findById(job.id()).isPresent()) {
                throw new JobAlreadyExistsException(job.id());
            }
            return jobs.insert(job);
        });
        reconciler.onJobCreated(stored);
        log.info("Job created: id={} schedule='{}' active={}", stored.id(), stored.schedule(), stored.active());
        return stored;
    }

    public synchronized JobDefinition update(String id, JobPatch patch) throws Exception {
        if (patch.url() != null) validateUrl(patch.url());
        if (patch.schedule() != null) {
            validateScheduleLength(patch.schedule());
            parser.validate(patch.schedule(), clock.now());
        }

        Change change = tx.required(() -> {
            JobDefinition current = jobs.findById(id).orElseThrow(() -> new JobNotFoundException(id));
            JobDefinition updated = patch.applyTo(current);
            validateSecret(updated.secret());
            Set<JobField> changed = JobField.diff(current, updated);
            if (!changed.isEmpty()) {
                jobs.update(updated);
            }
            return new Change(updated, changed);
        });
        reconciler.onJobUpdated(change.job(), change.fields());
        if (!change.fields().isEmpty()) {
            log.info("Job updated: id={} changed={}", id, change.fields());
        }
        return change.job();
    }

    public synchronized void delete(String id) throws Exception {
        boolean deleted = tx.required(() -> jobs.delete(id));
        if (!deleted) {
            throw new JobNotFoundException(id);
        }
        reconciler.onJobDeleted(id);
        log.info("Job deleted: id={}", id);
    }

    public JobDefinition get(String id) throws Exception {
        return tx.required(() -> jobs.findById(id)).orElseThrow(() -> new JobNotFoundException(id));
    }

    public List<JobDefinition> list() throws Exception {
        return tx.required(jobs::findAll);
    }

    public boolean isScheduled(String id) {
        return reconciler.isScheduled(id);
    }

    /** Newest first. A non-positive limit means the default; larger limits are capped. */
    public List<ExecutionRecord> logs(String jobId, int limit) throws Exception {
        int effective = limit <= 0 ? DEFAULT_LOG_LIMIT : Math.min(limit, MAX_LOG_LIMIT);
        return tx.required(() -> logs.findRecent(jobId, effective));
    }

    public JobStats stats() throws Exception {
        Instant startOfDay = LocalDate.ofInstant(clock.now(), parser.zone()).atStartOfDay(parser.zone()).toInstant();
        return tx.required(() -> {
            long total = jobs.countAll();
            long active = jobs.countActive();
            ExecutionSummary today = logs.summarizeSince(startOfDay);
            return new JobStats(total, active, today.total(), today.successRate());
        });
    }

    public HealthStatus health() throws Exception {
        long active = tx.required(jobs::countActive);
        Runtime rt = Runtime.getRuntime();
        long heapUsedMb = Math.round((rt.totalMemory() - rt.freeMemory()) / 1024.0 / 1024.0);
        return new HealthStatus(HealthStatus.HEALTHY, clock.now(), active, reconciler.scheduledCount(), heapUsedMb);
    }

    private static void validateId(String id) {
        if (id == null || !JOB_ID.matcher(id).matches()) {
            throw new InvalidJobException("Job id must match [A-Za-z0-9_-]+ (max 128 chars): " + id);
        }
    }

    private static void validateUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidJobException("Job url is required");
        }
        if (url.length() > MAX_URL_LENGTH) {
            throw new InvalidJobException("Job url is longer than " + MAX_URL_LENGTH + " characters");
        }
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidJobException("Job url is not a valid URI: " + url, e);
        }
        String scheme = uri.getScheme();
        if (!uri.isAbsolute() || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw new InvalidJobException("Job url must be an absolute http(s) URL: " + url);
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new InvalidJobException("Job url host is required: " + url);
        }
    }

    private static void validateScheduleLength(String schedule) {
        if (schedule != null && schedule.length() > MAX_SCHEDULE_LENGTH) {
            throw new InvalidJobException("Job schedule is longer than " + MAX_SCHEDULE_LENGTH + " characters");
        }
    }

    private static void validateSecret(String secret) {
        if (secret != null && secret.length() > MAX_SECRET_LENGTH) {
            throw new InvalidJobException("Job secret is longer than " + MAX_SECRET_LENGTH + " characters");
        }
    }

    private record Change(JobDefinition job, Set<JobField> fields) {}
}

package net.cronhook.core.registry;

import net.cronhook.core.schedule.CronSchedule;
import net.cronhook.core.schedule.ScheduleException;
import net.cronhook.core.schedule.ScheduleParser;
import net.cronhook.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns one live timer per job id. Each timer sleeps until its next fire instant, hands the
 * callback to the worker executor and then re-arms from the schedule, so non-uniform cron
 * fields are honoured.
 *
 * <p>Map mutations ({@link #upsert}, {@link #remove}, {@link #removeAll}) are serialized by one
 * lock; lookups never take it. A timer that has been cancelled never dispatches again, while a
 * callback already handed to the workers runs to completion.
 */
public final class TimerRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TimerRegistry.class);

    private final ScheduleParser parser;
    private final Clock clock;
    private final ScheduledExecutorService timerService;
    private final Executor workers;

    private final ConcurrentMap<String, JobTimer> timers = new ConcurrentHashMap<>();
    private final ReentrantLock mutation = new ReentrantLock();

    public TimerRegistry(ScheduleParser parser, Clock clock, ScheduledExecutorService timerService, Executor workers) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timerService = Objects.requireNonNull(timerService, "timerService");
        this.workers = Objects.requireNonNull(workers, "workers");
    }

    /**
     * Installs a timer for {@code jobId}, replacing any existing one. The old timer is cancelled
     * before the new one is armed. If the schedule has no upcoming fire time the registry is left
     * untouched and the exception propagates.
     */
    public void upsert(String jobId, CronSchedule schedule, FireCallback callback) {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(schedule, "schedule");
        Objects.requireNonNull(callback, "callback");

        mutation.lock();
        try {
            Instant first = parser.nextFireTime(schedule, clock.now());

            JobTimer previous = timers.get(jobId);
            if (previous != null) {
                previous.cancel();
            }
            JobTimer timer = new JobTimer(jobId, schedule, callback);
            timers.put(jobId, timer);
            timer.arm(first);
            log.debug("Timer {} job={} schedule='{}' first={}",
                    previous == null ? "installed" : "replaced", jobId, schedule.expression(), first);
        } finally {
            mutation.unlock();
        }
    }

    /** Cancels the job's timer. Returns false when no timer existed. */
    public boolean remove(String jobId) {
        mutation.lock();
        try {
            JobTimer timer = timers.remove(jobId);
            if (timer == null) {
                return false;
            }
            timer.cancel();
            log.debug("Timer removed job={}", jobId);
            return true;
        } finally {
            mutation.unlock();
        }
    }

    public void removeAll() {
        mutation.lock();
        try {
            timers.values().forEach(JobTimer::cancel);
            int count = timers.size();
            timers.clear();
            if (count > 0) log.info("Cancelled {} job timers", count);
        } finally {
            mutation.unlock();
        }
    }

    public boolean isScheduled(String jobId) {
        return timers.containsKey(jobId);
    }

    public Optional<Instant> nextFireTime(String jobId) {
        JobTimer timer = timers.get(jobId);
        return timer == null ? Optional.empty() : Optional.ofNullable(timer.nextFire);
    }

    public Set<String> scheduledJobIds() {
        return Set.copyOf(timers.keySet());
    }

    public int size() {
        return timers.size();
    }

    @Override
    public void close() {
        removeAll();
    }

    private void drop(JobTimer timer) {
        mutation.lock();
        try {
            timers.remove(timer.jobId, timer);
        } finally {
            mutation.unlock();
        }
    }

    private final class JobTimer {
        private final String jobId;
        private final CronSchedule schedule;
        private final FireCallback callback;

        // this로 보호
        private boolean cancelled;
        private ScheduledFuture<?> pending;

        private volatile Instant nextFire;

        JobTimer(String jobId, CronSchedule schedule, FireCallback callback) {
            this.jobId = jobId;
            this.schedule = schedule;
            this.callback = callback;
        }

        synchronized void arm(Instant at) {
            if (cancelled) return;
            long delayMs = Math.max(0L, Duration.between(clock.now(), at).toMillis());
            nextFire = at;
            pending = timerService.schedule(() -> fire(at), delayMs, TimeUnit.MILLISECONDS);
        }

        synchronized void cancel() {
            cancelled = true;
            nextFire = null;
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }

        private void fire(Instant fireTime) {
            boolean dead = false;
            synchronized (this) {
                if (cancelled) return;
                try {
                    workers.execute(() -> invoke(fireTime));
                } catch (RejectedExecutionException e) {
                    log.warn("Worker pool rejected firing job={} at {}; timer stopped", jobId, fireTime);
                    cancel();
                    dead = true;
                }
                if (!dead) {
                    try {
                        // 이번 발화 시각 이전부터 계산 금지 (일찍 깨어나도 중복 발화 없음)
                        Instant now = clock.now();
                        arm(parser.nextFireTime(schedule, now.isAfter(fireTime) ? now : fireTime));
                    } catch (ScheduleException e) {
                        log.error("Job {} has no further fire time, timer dropped: {}", jobId, e.getMessage());
                        cancel();
                        dead = true;
                    }
                }
            }
            if (dead) {
                drop(this);
            }
        }

        private void invoke(Instant fireTime) {
            try {
                callback.onFire(jobId, fireTime);
            } catch (RuntimeException e) {
                log.error("Fire callback failed job={} fireTime={}", jobId, fireTime, e);
            }
        }
    }
}

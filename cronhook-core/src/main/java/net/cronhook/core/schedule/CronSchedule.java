package net.cronhook.core.schedule;

import com.cronutils.model.time.ExecutionTime;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed five-field recurrence expression backed by a cron-utils {@link ExecutionTime}.
 * Instances are immutable and safe to share between threads.
 */
public final class CronSchedule {
    private final String expression;
    private final String normalized;
    private final ExecutionTime executionTime;
    private final boolean neverFires;

    CronSchedule(String expression, String normalized, ExecutionTime executionTime, boolean neverFires) {
        this.expression = expression;
        this.normalized = normalized;
        this.executionTime = executionTime;
        this.neverFires = neverFires;
    }

    public String expression() { return expression; }

    /**
     * Earliest minute strictly after {@code after} that satisfies every field, searching at most
     * {@code horizonYears} ahead.
     *
     * @throws UnreachableScheduleException when no minute within the horizon matches
     */
    public Instant next(Instant after, ZoneId zone, int horizonYears) {
        Objects.requireNonNull(after, "after");
        Objects.requireNonNull(zone, "zone");
        if (neverFires) {
            throw new UnreachableScheduleException(expression, after, horizonYears);
        }

        // 발화 시각은 항상 정각 분이므로 분 단위로 자른 시점 이후를 찾으면 됨
        ZonedDateTime from = after.atZone(zone).truncatedTo(ChronoUnit.MINUTES);
        Optional<ZonedDateTime> next = executionTime.nextExecution(from);
        if (next.isEmpty() || next.get().isAfter(from.plusYears(horizonYears))) {
            throw new UnreachableScheduleException(expression, after, horizonYears);
        }
        return next.get().toInstant();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronSchedule other)) return false;
        return normalized.equals(other.normalized);
    }

    @Override
    public int hashCode() {
        return normalized.hashCode();
    }

    @Override
    public String toString() {
        return "CronSchedule{" + expression + '}';
    }
}

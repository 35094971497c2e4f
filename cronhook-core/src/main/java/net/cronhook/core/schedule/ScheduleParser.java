package net.cronhook.core.schedule;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parses five-field recurrence expressions ({@code minute hour day-of-month month day-of-week})
 * and computes fire times from them. Fire times come from cron-utils with the UNIX definition.
 *
 * <p>Each field accepts {@code *}, a number, {@code *}/N, base/N, a range {@code a-b} (optionally
 * stepped), or a comma separated list of those. Names, {@code ?}, {@code L}, {@code W} and
 * {@code #} are rejected, and day-of-week is 0-6. Day-of-month and day-of-week are OR'ed when
 * neither is written as exactly {@code *}.
 */
public final class ScheduleParser {
    public static final int DEFAULT_HORIZON_YEARS = 5;

    // UNIX 5필드 정의 (초 필드 없음)
    private static final CronParser CRON =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ITEM = Pattern.compile("(\\*|\\d{1,9}(?:-\\d{1,9})?)(?:/(\\d{1,9}))?");

    // 월별 최대 일수 (2월은 윤년 기준)
    private static final int[] MAX_DAY = {0, 31, 29, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31};

    private final ZoneId zone;
    private final int horizonYears;

    public ScheduleParser() {
        this(ZoneOffset.UTC, DEFAULT_HORIZON_YEARS);
    }

    public ScheduleParser(ZoneId zone) {
        this(zone, DEFAULT_HORIZON_YEARS);
    }

    public ScheduleParser(ZoneId zone, int horizonYears) {
        if (horizonYears <= 0) throw new IllegalArgumentException("horizonYears must be > 0");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.horizonYears = horizonYears;
    }

    public ZoneId zone() { return zone; }

    public CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException(String.valueOf(expression), "expression is empty");
        }
        String trimmed = expression.trim();
        String[] parts = WHITESPACE.split(trimmed);
        if (parts.length != CronField.values().length) {
            throw new InvalidScheduleException(expression,
                    "expected 5 fields (minute hour day-of-month month day-of-week), got " + parts.length);
        }

        long[] masks = new long[parts.length];
        for (CronField field : CronField.values()) {
            masks[field.ordinal()] = check(expression, parts[field.ordinal()], field);
        }

        String normalized = String.join(" ", parts);
        ExecutionTime executionTime;
        try {
            executionTime = ExecutionTime.forCron(CRON.parse(normalized));
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException(expression, e.getMessage());
        }

        // day-of-week가 '*'이면 날짜 조건은 (월, 일) 조합만으로 결정됨
        boolean neverFires = parts[CronField.DAY_OF_WEEK.ordinal()].equals("*")
                && !anyValidDate(masks[CronField.MONTH.ordinal()], masks[CronField.DAY_OF_MONTH.ordinal()]);
        return new CronSchedule(trimmed, normalized, executionTime, neverFires);
    }

    /** Earliest fire time strictly after {@code after}. */
    public Instant nextFireTime(CronSchedule schedule, Instant after) {
        return schedule.next(after, zone, horizonYears);
    }

    /** Parses and checks that the schedule fires at least once after {@code now}. */
    public CronSchedule validate(String expression, Instant now) {
        CronSchedule schedule = parse(expression);
        nextFireTime(schedule, now);
        return schedule;
    }

    /** Checks one field's syntax and bounds; returns the mask of values it accepts. */
    private static long check(String expression, String text, CronField field) {
        long mask = 0L;
        for (String item : text.split(",", -1)) {
            var m = ITEM.matcher(item);
            if (!m.matches()) {
                throw new InvalidScheduleException(expression,
                        "'" + item + "' is not a valid " + field.label() + " value");
            }
            String range = m.group(1);
            int dash = range.indexOf('-');
            int from;
            int to;
            if (range.equals("*")) {
                from = field.min();
                to = field.max();
            } else {
                from = value(expression, dash < 0 ? range : range.substring(0, dash), field);
                to = dash < 0 ? from : value(expression, range.substring(dash + 1), field);
                if (from > to) {
                    throw new InvalidScheduleException(expression,
                            "inverted range " + range + " in " + field.label() + " field");
                }
            }
            int step = 1;
            if (m.group(2) != null) {
                step = Integer.parseInt(m.group(2));
                if (step <= 0) {
                    throw new InvalidScheduleException(expression, "step in " + field.label() + " field must be > 0");
                }
                if (dash < 0) to = field.max();   // base/N은 최댓값까지
            }
            for (int v = from; v <= to; v += step) mask |= 1L << v;
        }
        return mask;
    }

    private static int value(String expression, String text, CronField field) {
        int v = Integer.parseInt(text);
        if (v < field.min() || v > field.max()) {
            throw new InvalidScheduleException(expression,
                    field.label() + " value " + v + " out of range [" + field.min() + "-" + field.max() + "]");
        }
        return v;
    }

    private static boolean anyValidDate(long months, long daysOfMonth) {
        for (int month = 1; month <= 12; month++) {
            if ((months & (1L << month)) == 0) continue;
            for (int day = 1; day <= MAX_DAY[month]; day++) {
                if ((daysOfMonth & (1L << day)) != 0) return true;
            }
        }
        return false;
    }
}

package net.cronhook.core.schedule;

import java.time.Instant;

public class UnreachableScheduleException extends ScheduleException {
    public UnreachableScheduleException(String expression, Instant after, int horizonYears) {
        super(expression, "Cron schedule '" + expression + "' has no fire time within "
                + horizonYears + " years after " + after);
    }
}

package net.cronhook.core.schedule;

public class InvalidScheduleException extends ScheduleException {
    public InvalidScheduleException(String expression, String message) {
        super(expression, "Invalid cron schedule '" + expression + "': " + message);
    }
}

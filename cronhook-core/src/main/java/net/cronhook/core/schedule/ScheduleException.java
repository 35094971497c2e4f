package net.cronhook.core.schedule;

/** Raised when a recurrence expression cannot be used to schedule a job. */
public class ScheduleException extends IllegalArgumentException {
    private final String expression;

    public ScheduleException(String expression, String message) {
        super(message);
        this.expression = expression;
    }

    public String expression() { return expression; }
}

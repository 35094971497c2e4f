package net.cronhook.core.model;

/** Result of one outbound call, before it is tied to a job and a record id. */
public record ExecutionOutcome(
        ExecutionStatus status,
        Integer responseCode,   // 응답 못 받으면 null
        long durationMs,
        String errorMessage     // ERROR일 때만
) {
    public static ExecutionOutcome responded(int responseCode, long durationMs) {
        return new ExecutionOutcome(ExecutionStatus.SUCCESS, responseCode, durationMs, null);
    }

    public static ExecutionOutcome rejected(int responseCode, long durationMs, String errorMessage) {
        return new ExecutionOutcome(ExecutionStatus.ERROR, responseCode, durationMs, errorMessage);
    }

    public static ExecutionOutcome transportFailure(long durationMs, String errorMessage) {
        return new ExecutionOutcome(ExecutionStatus.ERROR, null, durationMs, errorMessage);
    }

    public boolean succeeded() {
        return status == ExecutionStatus.SUCCESS;
    }
}

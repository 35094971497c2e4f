package net.cronhook.core.model;

public record ExecutionSummary(long total, long successful) {
    public static final ExecutionSummary EMPTY = new ExecutionSummary(0, 0);

    /** Percent rounded to one decimal; 100 when nothing ran. */
    public double successRate() {
        if (total == 0) return 100.0;
        return Math.round(successful * 1000.0 / total) / 10.0;
    }
}

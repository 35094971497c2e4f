package net.cronhook.core.schedule;

/** The five fields of a recurrence expression, in order, with their inclusive bounds. */
public enum CronField {
    MINUTE("minute", 0, 59),
    HOUR("hour", 0, 23),
    DAY_OF_MONTH("day-of-month", 1, 31),
    MONTH("month", 1, 12),
    DAY_OF_WEEK("day-of-week", 0, 6);   // 0 = 일요일

    private final String label;
    private final int min;
    private final int max;

    CronField(String label, int min, int max) {
        this.label = label;
        this.min = min;
        this.max = max;
    }

    public String label() { return label; }
    public int min() { return min; }
    public int max() { return max; }
}

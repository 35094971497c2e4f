package net.cronhook.core.model;

public enum ExecutionStatus {
    SUCCESS, ERROR;

    public static ExecutionStatus from(String s) {
        if (s == null) throw new IllegalArgumentException("status must not be null");
        return ExecutionStatus.valueOf(s.trim().toUpperCase());
    }

    /** Stored and reported form: "success" / "error". */
    public String code() { return name().toLowerCase(); }
}

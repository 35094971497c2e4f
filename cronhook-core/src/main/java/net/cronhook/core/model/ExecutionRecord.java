package net.cronhook.core.model;

import java.time.Instant;
import java.util.UUID;

public record ExecutionRecord(
        String id,
        String jobId,
        Instant timestamp,      // 완료 시각
        ExecutionStatus status,
        Integer responseCode,
        long durationMs,
        String errorMessage
) {
    public static ExecutionRecord of(String jobId, ExecutionOutcome outcome, Instant completedAt) {
        return new ExecutionRecord(
                UUID.randomUUID().toString(),
                jobId,
                completedAt,
                outcome.status(),
                outcome.responseCode(),
                outcome.durationMs(),
                outcome.errorMessage()
        );
    }
}

package net.cronhook.core.model;

import java.time.Instant;

/** 상태 스냅샷: DB 활성 잡 수와 이 프로세스에 실제 걸린 타이머 수 */
public record HealthStatus(
        String status,
        Instant timestamp,
        long activeJobs,
        int scheduledTimers,
        long heapUsedMb
) {
    public static final String HEALTHY = "healthy";
}

package net.cronhook.core.model;

public record JobStats(
        long totalJobs,
        long activeJobs,
        long executionsToday,
        double successRate      // 퍼센트, 소수 1자리
) {}

package net.cronhook.core.spi;

import net.cronhook.core.model.ExecutionRecord;
import net.cronhook.core.model.ExecutionSummary;

import java.time.Instant;
import java.util.List;

public interface ExecutionLogRepository extends LogSink {
    /** 최신순, jobId null = 전체 */
    List<ExecutionRecord> findRecent(String jobId, int limit) throws Exception;

    int deleteOlderThan(Instant threshold) throws Exception;

    ExecutionSummary summarizeSince(Instant since) throws Exception;
}

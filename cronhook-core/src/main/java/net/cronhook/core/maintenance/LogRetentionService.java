package net.cronhook.core.maintenance;

import net.cronhook.core.spi.Clock;
import net.cronhook.core.spi.ExecutionLogRepository;
import net.cronhook.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

public final class LogRetentionService {
    private static final Logger log = LoggerFactory.getLogger(LogRetentionService.class);

    public static final Duration DEFAULT_RETENTION = Duration.ofDays(30);

    private final ExecutionLogRepository logs;
    private final TxRunner tx;
    private final Clock clock;

    public LogRetentionService(ExecutionLogRepository logs, TxRunner tx, Clock clock) {
        this.logs = logs;
        this.tx = tx;
        this.clock = clock;
    }

    public RetentionReport purgeOlderThanDays(int days) throws Exception {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be > 0: " + days);
        }
        return purgeOlderThan(Duration.ofDays(days));
    }

    /** Deletes execution records whose timestamp is before {@code now - retention}. */
    public RetentionReport purgeOlderThan(Duration retention) throws Exception {
        if (retention == null || retention.isZero() || retention.isNegative()) {
            throw new IllegalArgumentException("retention must be positive: " + retention);
        }
        Instant now = clock.now();
        Instant threshold = now.minus(retention);
        int deleted = tx.required(() -> logs.deleteOlderThan(threshold));
        if (deleted > 0) {
            log.info("Deleted {} execution logs older than {}", deleted, threshold);
        } else {
            log.debug("No execution logs older than {}", threshold);
        }
        return new RetentionReport(now, threshold, deleted);
    }

    public record RetentionReport(Instant timestamp, Instant threshold, int deletedLogs) {}
}

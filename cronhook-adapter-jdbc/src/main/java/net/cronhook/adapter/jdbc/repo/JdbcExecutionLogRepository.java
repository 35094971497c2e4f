package net.cronhook.adapter.jdbc.repo;

import net.cronhook.adapter.jdbc.JdbcUtil;
import net.cronhook.adapter.jdbc.TxContext;
import net.cronhook.adapter.jdbc.mapper.RowMappers;
import net.cronhook.core.model.ExecutionRecord;
import net.cronhook.core.model.ExecutionStatus;
import net.cronhook.core.model.ExecutionSummary;
import net.cronhook.core.spi.ExecutionLogRepository;
import net.cronhook.core.spi.TxRunner;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code execution_logs} 테이블.
 * 조회/삭제는 호출자 트랜잭션에 참여, {@link #record}는 워커 스레드에서 불리므로 없으면 새로 엶.
 */
public final class JdbcExecutionLogRepository implements ExecutionLogRepository {
    public static final int MAX_ERROR_LENGTH = 4000;

    private final TxRunner tx;

    public JdbcExecutionLogRepository(TxRunner tx) { this.tx = tx; }

    @Override
    public void record(ExecutionRecord r) throws Exception {
        tx.required(() -> {
            try (PreparedStatement ps = mustConn().prepareStatement("""
                    INSERT INTO execution_logs (id, job_id, executed_at, status, response_code, duration_ms, error_message)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """)) {
                ps.setString(1, r.id());
                ps.setString(2, r.jobId());
                ps.setTimestamp(3, JdbcUtil.ts(r.timestamp()));
                ps.setString(4, r.status().code());
                JdbcUtil.setInteger(ps, 5, r.responseCode());
                ps.setLong(6, r.durationMs());
                ps.setString(7, JdbcUtil.truncate(r.errorMessage(), MAX_ERROR_LENGTH));
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public List<ExecutionRecord> findRecent(String jobId, int limit) throws Exception {
        String sql = jobId == null
                ? "SELECT * FROM execution_logs ORDER BY executed_at DESC, id DESC LIMIT ?"
                : "SELECT * FROM execution_logs WHERE job_id = ? ORDER BY executed_at DESC, id DESC LIMIT ?";
        try (PreparedStatement ps = mustConn().prepareStatement(sql)) {
            int i = 1;
            if (jobId != null) ps.setString(i++, jobId);
            ps.setInt(i, limit);
            try (ResultSet rs = ps.executeQuery()) {
                var out = new ArrayList<ExecutionRecord>();
                while (rs.next()) out.add(RowMappers.toExecutionRecord(rs));
                return out;
            }
        }
    }

    @Override
    public int deleteOlderThan(Instant threshold) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("DELETE FROM execution_logs WHERE executed_at < ?")) {
            ps.setTimestamp(1, JdbcUtil.ts(threshold));
            return ps.executeUpdate();
        }
    }

    @Override
    public ExecutionSummary summarizeSince(Instant since) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                SELECT COUNT(*) AS total,
                       COALESCE(SUM(CASE WHEN status = ? THEN 1 ELSE 0 END), 0) AS successful
                  FROM execution_logs
                 WHERE executed_at >= ?
            """)) {
            ps.setString(1, ExecutionStatus.SUCCESS.code());
            ps.setTimestamp(2, JdbcUtil.ts(since));
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return ExecutionSummary.EMPTY;
                return new ExecutionSummary(rs.getLong("total"), rs.getLong("successful"));
            }
        }
    }

    private Connection mustConn() {
        return TxContext.require();
    }
}

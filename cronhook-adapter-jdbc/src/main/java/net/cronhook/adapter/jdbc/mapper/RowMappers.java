package net.cronhook.adapter.jdbc.mapper;

import net.cronhook.adapter.jdbc.JdbcUtil;
import net.cronhook.core.model.ExecutionRecord;
import net.cronhook.core.model.ExecutionStatus;
import net.cronhook.core.model.JobDefinition;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- cron_jobs ---
    public static JobDefinition toJob(ResultSet rs) throws SQLException {
        return new JobDefinition(
                rs.getString("id"),
                rs.getString("url"),
                rs.getString("schedule"),
                rs.getString("body"),
                rs.getString("cron_secret"),
                rs.getBoolean("is_active"),
                JdbcUtil.toInstant(rs.getTimestamp("created_at")),
                rs.getString("created_by")
        );
    }

    // --- execution_logs ---
    public static ExecutionRecord toExecutionRecord(ResultSet rs) throws SQLException {
        return new ExecutionRecord(
                rs.getString("id"),
                rs.getString("job_id"),
                rs.getTimestamp("executed_at").toInstant(),
                ExecutionStatus.from(rs.getString("status")),
                JdbcUtil.getInteger(rs, "response_code"),
                rs.getLong("duration_ms"),
                rs.getString("error_message")
        );
    }
}

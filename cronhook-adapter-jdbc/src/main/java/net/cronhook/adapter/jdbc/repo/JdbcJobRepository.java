package net.cronhook.adapter.jdbc.repo;

import net.cronhook.adapter.jdbc.TxContext;
import net.cronhook.adapter.jdbc.mapper.RowMappers;
import net.cronhook.core.model.JobDefinition;
import net.cronhook.core.spi.JobRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** {@code cron_jobs} 테이블. 호출 전 TxRunner로 커넥션이 바인딩되어 있어야 함 */
public final class JdbcJobRepository implements JobRepository {

    @Override
    public List<JobDefinition> loadActiveJobs() throws Exception {
        return query("SELECT * FROM cron_jobs WHERE is_active = TRUE ORDER BY id");
    }

    @Override
    public List<JobDefinition> findAll() throws Exception {
        return query("SELECT * FROM cron_jobs ORDER BY created_at, id");
    }

    @Override
    public Optional<JobDefinition> findById(String id) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("SELECT * FROM cron_jobs WHERE id = ?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toJob(rs));
            }
        }
    }

    @Override
    public JobDefinition insert(JobDefinition job) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                INSERT INTO cron_jobs (id, url, schedule, body, cron_secret, is_active, created_by, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
            """)) {
            int i = 1;
            ps.setString(i++, job.id());
            ps.setString(i++, job.url());
            ps.setString(i++, job.schedule());
            ps.setString(i++, job.body());
            ps.setString(i++, job.secret());
            ps.setBoolean(i++, job.active());
            ps.setString(i, job.createdBy() == null ? JobDefinition.DEFAULT_CREATOR : job.createdBy());
            ps.executeUpdate();
        }
        // created_at은 DB 기본값
        return findById(job.id()).orElseThrow(() -> new IllegalStateException("insert failed to load job: " + job.id()));
    }

    @Override
    public void update(JobDefinition job) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                UPDATE cron_jobs
                   SET url         = ?,
                       schedule    = ?,
                       body        = ?,
                       cron_secret = ?,
                       is_active   = ?,
                       updated_at  = CURRENT_TIMESTAMP
                 WHERE id = ?
            """)) {
            ps.setString(1, job.url());
            ps.setString(2, job.schedule());
            ps.setString(3, job.body());
            ps.setString(4, job.secret());
            ps.setBoolean(5, job.active());
            ps.setString(6, job.id());
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("cron_jobs not found for id=" + job.id());
            }
        }
    }

    @Override
    public boolean delete(String id) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("DELETE FROM cron_jobs WHERE id = ?")) {
            ps.setString(1, id);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public long countAll() throws Exception {
        return count("SELECT COUNT(*) FROM cron_jobs");
    }

    @Override
    public long countActive() throws Exception {
        return count("SELECT COUNT(*) FROM cron_jobs WHERE is_active = TRUE");
    }

    private List<JobDefinition> query(String sql) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            var out = new ArrayList<JobDefinition>();
            while (rs.next()) out.add(RowMappers.toJob(rs));
            return out;
        }
    }

    private long count(String sql) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private Connection mustConn() {
        return TxContext.require();
    }
}

package net.scanorama.adapter.jdbc.repo;

import net.scanorama.adapter.jdbc.JdbcUtil;
import net.scanorama.adapter.jdbc.TxContext;
import net.scanorama.adapter.jdbc.mapper.RowMappers;
import net.scanorama.core.model.JobRecord;
import net.scanorama.core.spi.JobStore;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** scheduled_jobs on PostgreSQL. The config payload is stored as JSONB and read back as text. */
public final class JdbcJobStore implements JobStore {
    private static final String COLUMNS = """
            id, name, type, cron_expression, config::text AS config, enabled,
            last_run, next_run, created_at, last_run_status, last_run_duration_ms, consecutive_failures
            """;

    @Override
    public void create(JobRecord job) throws Exception {
        try (var ps = TxContext.required().prepareStatement("""
                INSERT INTO scheduled_jobs
                    (id, name, type, cron_expression, config, enabled, last_run, next_run, created_at,
                     last_run_status, last_run_duration_ms, consecutive_failures)
                VALUES (?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?)
            """)) {
            int i = 1;
            ps.setObject(i++, job.id());
            ps.setString(i++, job.name());
            ps.setString(i++, job.type().code());
            ps.setString(i++, job.cronExpr());
            ps.setString(i++, job.configPayload());
            ps.setBoolean(i++, job.enabled());
            ps.setTimestamp(i++, JdbcUtil.ts(job.lastRun()));
            ps.setTimestamp(i++, JdbcUtil.ts(job.nextRun()));
            ps.setTimestamp(i++, JdbcUtil.ts(job.createdAt()));
            ps.setString(i++, job.lastRunStatus() == null ? null : job.lastRunStatus().code());
            JdbcUtil.setNullableLong(ps, i++, job.lastRunDurationMs());
            ps.setInt(i++, job.consecutiveFailures());
            ps.executeUpdate();
        }
    }

    @Override
    public List<JobRecord> findAll() throws Exception {
        try (var ps = TxContext.required().prepareStatement(
                "SELECT " + COLUMNS + " FROM scheduled_jobs ORDER BY created_at, name");
             ResultSet rs = ps.executeQuery()) {
            List<JobRecord> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toJobRecord(rs));
            return out;
        }
    }

    @Override
    public Optional<JobRecord> findById(UUID id) throws Exception {
        try (var ps = TxContext.required().prepareStatement(
                "SELECT " + COLUMNS + " FROM scheduled_jobs WHERE id = ?")) {
            ps.setObject(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toJobRecord(rs));
            }
        }
    }

    @Override
    public void update(JobRecord job) throws Exception {
        try (var ps = TxContext.required().prepareStatement("""
                UPDATE scheduled_jobs
                   SET name                 = ?,
                       cron_expression      = ?,
                       config               = ?::jsonb,
                       last_run             = ?,
                       next_run             = ?,
                       last_run_status      = ?,
                       last_run_duration_ms = ?,
                       consecutive_failures = ?
                 WHERE id = ?
            """)) {
            int i = 1;
            ps.setString(i++, job.name());
            ps.setString(i++, job.cronExpr());
            ps.setString(i++, job.configPayload());
            ps.setTimestamp(i++, JdbcUtil.ts(job.lastRun()));
            ps.setTimestamp(i++, JdbcUtil.ts(job.nextRun()));
            ps.setString(i++, job.lastRunStatus() == null ? null : job.lastRunStatus().code());
            JdbcUtil.setNullableLong(ps, i++, job.lastRunDurationMs());
            ps.setInt(i++, job.consecutiveFailures());
            ps.setObject(i++, job.id());
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("scheduled_jobs row not found for id=" + job.id());
            }
        }
    }

    @Override
    public void delete(UUID id) throws Exception {
        try (var ps = TxContext.required().prepareStatement("DELETE FROM scheduled_jobs WHERE id = ?")) {
            ps.setObject(1, id);
            ps.executeUpdate();
        }
    }

    @Override
    public void setEnabled(UUID id, boolean enabled) throws Exception {
        try (var ps = TxContext.required().prepareStatement("UPDATE scheduled_jobs SET enabled = ? WHERE id = ?")) {
            ps.setBoolean(1, enabled);
            ps.setObject(2, id);
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("scheduled_jobs row not found for id=" + id);
            }
        }
    }
}

package net.scanorama.adapter.jdbc.mapper;

import net.scanorama.adapter.jdbc.JdbcUtil;
import net.scanorama.core.model.*;

import java.sql.*;

public final class RowMappers {
    private RowMappers() {}

    // --- scheduled_jobs ---
    public static JobRecord toJobRecord(ResultSet rs) throws SQLException {
        return new JobRecord(
                JdbcUtil.uuid(rs, "id"),
                rs.getString("name"),
                JobType.from(rs.getString("type")),
                rs.getString("cron_expression"),
                rs.getString("config"),
                rs.getBoolean("enabled"),
                JdbcUtil.toInstant(rs.getTimestamp("last_run")),
                JdbcUtil.toInstant(rs.getTimestamp("next_run")),
                rs.getTimestamp("created_at").toInstant(),
                RunStatus.from(rs.getString("last_run_status")),
                JdbcUtil.nullableLong(rs, "last_run_duration_ms"),
                rs.getInt("consecutive_failures")
        );
    }

    // --- hosts ---
    public static Host toHost(ResultSet rs) throws SQLException {
        return new Host(
                JdbcUtil.uuid(rs, "id"),
                rs.getString("ip_address"),
                rs.getString("hostname"),
                rs.getString("os_family"),
                Host.Status.from(rs.getString("status")),
                JdbcUtil.toInstant(rs.getTimestamp("last_seen"))
        );
    }

    // --- scan_profiles ---
    public static ScanProfile toProfile(ResultSet rs) throws SQLException {
        return new ScanProfile(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("description"),
                JdbcUtil.strings(rs, "os_family"),
                rs.getString("ports"),
                rs.getString("scan_type"),
                rs.getString("timing"),
                rs.getInt("priority"),
                rs.getBoolean("built_in")
        );
    }
}

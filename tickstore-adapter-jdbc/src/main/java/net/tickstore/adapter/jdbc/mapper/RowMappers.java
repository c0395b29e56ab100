package net.tickstore.adapter.jdbc.mapper;

import net.tickstore.adapter.jdbc.JdbcUtil;
import net.tickstore.core.model.JobAndNextTick;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    public static final String JOB_COLUMNS = """
            id, last_updated, next_tick, last_tick, job_type, count, ran, stopped,
            time_offset_seconds, extra, schedule, repeated_every, repeating""";

    // --- jobs ---
    public static JobRow toJobRow(ResultSet rs) throws SQLException {
        return new JobRow(
                JdbcUtil.getUuid(rs, "id"),
                JdbcUtil.getLong(rs, "last_updated"),
                JdbcUtil.getLong(rs, "next_tick"),
                JdbcUtil.getLong(rs, "last_tick"),
                rs.getInt("job_type"),
                JdbcUtil.getInt(rs, "count"),
                JdbcUtil.getBoolean(rs, "ran"),
                JdbcUtil.getBoolean(rs, "stopped"),
                JdbcUtil.getInt(rs, "time_offset_seconds"),
                rs.getBytes("extra"),
                rs.getString("schedule"),
                JdbcUtil.getLong(rs, "repeated_every"),
                JdbcUtil.getBoolean(rs, "repeating")
        );
    }

    // --- next ticks ---
    public static JobAndNextTick toJobAndNextTick(ResultSet rs) throws SQLException {
        Long next = JdbcUtil.getLong(rs, "next_tick");
        return new JobAndNextTick(
                JdbcUtil.getUuid(rs, "id"),
                next == null ? 0L : next,
                rs.getInt("job_type"),
                JdbcUtil.getLong(rs, "last_tick")
        );
    }
}

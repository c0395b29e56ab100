package net.tickstore.adapter.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Upsert statements differ per database. Both variants take the same parameters in the same
 * (column) order, so callers bind them identically.
 */
public enum SqlDialect {
    POSTGRESQL {
        @Override
        public String upsertJob() {
            return """
                INSERT INTO jobs (id, last_updated, next_tick, last_tick, job_type, count, ran, stopped,
                                  schedule, repeating, repeated_every, time_offset_seconds, extra)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (id) DO UPDATE SET
                    last_updated        = EXCLUDED.last_updated,
                    next_tick           = EXCLUDED.next_tick,
                    last_tick           = EXCLUDED.last_tick,
                    job_type            = EXCLUDED.job_type,
                    count               = EXCLUDED.count,
                    ran                 = EXCLUDED.ran,
                    stopped             = EXCLUDED.stopped,
                    schedule            = EXCLUDED.schedule,
                    repeating           = EXCLUDED.repeating,
                    repeated_every      = EXCLUDED.repeated_every,
                    time_offset_seconds = EXCLUDED.time_offset_seconds,
                    extra               = EXCLUDED.extra
                """;
        }

        @Override
        public String upsertNotification() {
            return """
                INSERT INTO notifications (id, job_id, extra)
                VALUES (?, ?, ?)
                ON CONFLICT (id) DO UPDATE SET
                    job_id = EXCLUDED.job_id,
                    extra  = EXCLUDED.extra
                """;
        }
    },

    H2 {
        @Override
        public String upsertJob() {
            return """
                MERGE INTO jobs (id, last_updated, next_tick, last_tick, job_type, count, ran, stopped,
                                 schedule, repeating, repeated_every, time_offset_seconds, extra)
                KEY (id)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        }

        @Override
        public String upsertNotification() {
            return """
                MERGE INTO notifications (id, job_id, extra)
                KEY (id)
                VALUES (?, ?, ?)
                """;
        }
    };

    public abstract String upsertJob();

    public abstract String upsertNotification();

    public static SqlDialect of(Connection c) throws SQLException {
        String product = c.getMetaData().getDatabaseProductName().toLowerCase(Locale.ROOT);
        if (product.contains("postgres")) return POSTGRESQL;
        if (product.contains("h2")) return H2;
        throw new SQLException("Unsupported database: " + product);
    }
}

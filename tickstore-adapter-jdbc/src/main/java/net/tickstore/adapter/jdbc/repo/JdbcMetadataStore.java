package net.tickstore.adapter.jdbc.repo;

import net.tickstore.adapter.jdbc.JdbcUtil;
import net.tickstore.adapter.jdbc.SqlDialect;
import net.tickstore.adapter.jdbc.TxContext;
import net.tickstore.adapter.jdbc.hook.JobAddHook;
import net.tickstore.adapter.jdbc.mapper.JobRecordMapper;
import net.tickstore.adapter.jdbc.mapper.JobRow;
import net.tickstore.adapter.jdbc.mapper.RowMappers;
import net.tickstore.core.codec.JobExtraCodec;
import net.tickstore.core.error.CantAddException;
import net.tickstore.core.error.CantRemoveException;
import net.tickstore.core.error.FetchFailureException;
import net.tickstore.core.error.MappingException;
import net.tickstore.core.error.NotFoundException;
import net.tickstore.core.error.UpdateFailureException;
import net.tickstore.core.model.JobAndNextTick;
import net.tickstore.core.model.JobExtra;
import net.tickstore.core.model.JobStoredData;
import net.tickstore.core.spi.Clock;
import net.tickstore.core.spi.MetadataStore;
import net.tickstore.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Relational {@link MetadataStore}. Every job must carry an extra payload naming its owner and
 * extension type; registered {@link JobAddHook}s decide whether a job is already satisfied and
 * write their linkage rows in the same transaction as the job row.
 */
public final class JdbcMetadataStore implements MetadataStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcMetadataStore.class);

    private final DataSource ds;
    private final TxRunner tx;
    private final Clock clock;
    private final JobExtraCodec codec;
    private final List<JobAddHook> hooks;

    private volatile SqlDialect dialect;

    private JdbcMetadataStore(Builder b) {
        this.ds = Objects.requireNonNull(b.ds, "dataSource");
        this.tx = Objects.requireNonNull(b.tx, "txRunner");
        this.clock = b.clock;
        this.codec = b.codec;
        this.hooks = List.copyOf(b.hooks);
    }

    public static Builder builder(DataSource ds) { return new Builder(ds); }

    @Override
    public JobStoredData get(UUID id) throws FetchFailureException {
        JobRow row;
        try {
            row = tx.required(() -> {
                try (PreparedStatement ps = TxContext.require().prepareStatement(
                        "SELECT " + RowMappers.JOB_COLUMNS + " FROM jobs WHERE id = ?")) {
                    ps.setObject(1, id);
                    try (ResultSet rs = ps.executeQuery()) {
                        return rs.next() ? RowMappers.toJobRow(rs) : null;
                    }
                }
            });
        } catch (Exception e) {
            log.error("Failed to fetch job {}: {}", id, e.getMessage());
            throw new FetchFailureException("Failed to fetch job " + id, e);
        }

        if (row == null) {
            log.warn("Job with id {} not found", id);
            throw new NotFoundException("Job", id);
        }
        try {
            return JobRecordMapper.toDescriptor(row);
        } catch (MappingException e) {
            log.error("Job {} is stored in an unreadable form: {}", id, e.getMessage());
            throw new FetchFailureException("Failed to map job " + id, e);
        }
    }

    @Override
    public void addOrUpdate(JobStoredData data) throws CantAddException {
        JobRow row;
        JobExtra extra;
        try {
            row = JobRecordMapper.toRow(data);
        } catch (MappingException e) {
            log.error("Failed to map job {}: {}", data.id(), e.getMessage());
            throw new CantAddException("Invalid job descriptor", e);
        }
        try {
            extra = codec.decode(row.extra());
        } catch (MappingException e) {
            log.error("Job {} has no usable extra data: {}", row.id(), e.getMessage());
            throw new CantAddException("Job " + row.id() + " has no usable extra data", e);
        }

        if (alreadySatisfied(row, extra)) {
            log.info("Job {} for user {} already satisfied, nothing written", row.id(), extra.ownerId());
            return;
        }

        try {
            tx.requiresNew(() -> {
                Connection c = TxContext.require();
                try (PreparedStatement ps = c.prepareStatement(dialect(c).upsertJob())) {
                    bindJob(ps, row);
                    ps.executeUpdate();
                } catch (SQLException e) {
                    log.error("Failed to insert or update job {}: {}", row.id(), e.getMessage());
                    throw new CantAddException("Failed to insert or update job " + row.id(), e);
                }

                for (JobAddHook hook : hooks) {
                    try {
                        hook.afterAdd(row, extra, c);
                    } catch (Exception e) {
                        log.error("After-add hook {} failed for job {} (user {}): {}",
                                hook.getClass().getSimpleName(), row.id(), extra.ownerId(), e.getMessage());
                        throw new CantAddException("After-add hook failed for job " + row.id(), e);
                    }
                }
                return null;
            });
        } catch (CantAddException e) {
            throw e;
        } catch (Exception e) {
            log.error("Transaction for job {} failed: {}", row.id(), e.getMessage());
            throw new CantAddException("Failed to commit job " + row.id(), e);
        }
    }

    private boolean alreadySatisfied(JobRow row, JobExtra extra) throws CantAddException {
        if (hooks.isEmpty()) return false;
        try (Connection c = ds.getConnection()) {
            for (JobAddHook hook : hooks) {
                if (hook.beforeAdd(row, extra, c)) return true;
            }
            return false;
        } catch (Exception e) {
            log.error("Before-add check failed for job {} (user {}): {}", row.id(), extra.ownerId(), e.getMessage());
            throw new CantAddException("Before-add check failed for job " + row.id(), e);
        }
    }

    @Override
    public void delete(UUID id) throws CantRemoveException {
        try {
            tx.required(() -> {
                // linkage and notification rows go with it (ON DELETE CASCADE)
                try (PreparedStatement ps = TxContext.require().prepareStatement("DELETE FROM jobs WHERE id = ?")) {
                    ps.setObject(1, id);
                    return ps.executeUpdate();
                }
            });
        } catch (Exception e) {
            log.error("Failed to delete job {}: {}", id, e.getMessage());
            throw new CantRemoveException("Failed to delete job " + id, e);
        }
    }

    @Override
    public List<JobAndNextTick> listNextTicks() throws FetchFailureException {
        return listNextTicks(clock.now());
    }

    @Override
    public List<JobAndNextTick> listNextTicks(Instant now) throws FetchFailureException {
        try {
            return tx.required(() -> {
                try (PreparedStatement ps = TxContext.require().prepareStatement("""
                        SELECT id, next_tick, job_type, last_tick
                          FROM jobs
                         WHERE next_tick > 0 AND next_tick <= ?
                        """)) {
                    ps.setLong(1, now.getEpochSecond());
                    try (ResultSet rs = ps.executeQuery()) {
                        List<JobAndNextTick> out = new ArrayList<>();
                        while (rs.next()) out.add(RowMappers.toJobAndNextTick(rs));
                        return out;
                    }
                }
            });
        } catch (Exception e) {
            log.error("Failed to list next ticks at {}: {}", now, e.getMessage());
            throw new FetchFailureException("Failed to list next ticks", e);
        }
    }

    @Override
    public void setNextAndLastTick(UUID id, Instant nextTick, Instant lastTick) throws UpdateFailureException {
        long next = nextTick == null ? 0L : nextTick.getEpochSecond();
        Long last = lastTick == null ? null : lastTick.getEpochSecond();
        int updated;
        try {
            updated = tx.required(() -> {
                try (PreparedStatement ps = TxContext.require().prepareStatement(
                        "UPDATE jobs SET next_tick = ?, last_tick = ? WHERE id = ?")) {
                    ps.setLong(1, next);
                    JdbcUtil.setLong(ps, 2, last);
                    ps.setObject(3, id);
                    return ps.executeUpdate();
                }
            });
        } catch (Exception e) {
            log.error("Failed to set next and last tick for job {}: {}", id, e.getMessage());
            throw new UpdateFailureException("Failed to set next and last tick for job " + id, e);
        }
        if (updated == 0) {
            log.warn("No job {} to set ticks on", id);
        }
    }

    @Override
    public Optional<Duration> timeTillNextJob() throws FetchFailureException {
        long now = clock.epochSeconds();
        Long next;
        try {
            next = tx.required(() -> {
                try (PreparedStatement ps = TxContext.require().prepareStatement("""
                        SELECT next_tick
                          FROM jobs
                         WHERE next_tick > 0 AND next_tick > ?
                         ORDER BY next_tick ASC
                         FETCH FIRST 1 ROWS ONLY
                        """)) {
                    ps.setLong(1, now);
                    try (ResultSet rs = ps.executeQuery()) {
                        return rs.next() ? rs.getLong(1) : null;
                    }
                }
            });
        } catch (Exception e) {
            log.error("Failed to fetch next job time: {}", e.getMessage());
            throw new FetchFailureException("Failed to fetch next job time", e);
        }
        if (next == null || next - now <= 0) return Optional.empty();
        return Optional.of(Duration.ofSeconds(next - now));
    }

    private SqlDialect dialect(Connection c) throws SQLException {
        SqlDialect d = dialect;
        if (d == null) {
            d = SqlDialect.of(c);
            dialect = d;
        }
        return d;
    }

    private static void bindJob(PreparedStatement ps, JobRow row) throws SQLException {
        int i = 1;
        ps.setObject(i++, row.id());
        JdbcUtil.setLong(ps, i++, row.lastUpdated());
        JdbcUtil.setLong(ps, i++, row.nextTick());
        JdbcUtil.setLong(ps, i++, row.lastTick());
        ps.setInt(i++, row.jobType());
        JdbcUtil.setInt(ps, i++, row.count());
        JdbcUtil.setBoolean(ps, i++, row.ran());
        JdbcUtil.setBoolean(ps, i++, row.stopped());
        JdbcUtil.setString(ps, i++, row.schedule());
        JdbcUtil.setBoolean(ps, i++, row.repeating());
        JdbcUtil.setLong(ps, i++, row.repeatedEvery());
        JdbcUtil.setInt(ps, i++, row.timeOffsetSeconds());
        JdbcUtil.setBytes(ps, i, row.extra());
    }

    public static final class Builder {
        private final DataSource ds;
        private TxRunner tx;
        private Clock clock = Instant::now;
        private JobExtraCodec codec = new JobExtraCodec();
        private final List<JobAddHook> hooks = new ArrayList<>();

        private Builder(DataSource ds) { this.ds = ds; }

        public Builder txRunner(TxRunner tx) { this.tx = tx; return this; }

        public Builder clock(Clock clock) { this.clock = Objects.requireNonNull(clock); return this; }

        public Builder codec(JobExtraCodec codec) { this.codec = Objects.requireNonNull(codec); return this; }

        public Builder hook(JobAddHook hook) { this.hooks.add(Objects.requireNonNull(hook)); return this; }

        public Builder hooks(List<? extends JobAddHook> hooks) { hooks.forEach(this::hook); return this; }

        public JdbcMetadataStore build() {
            if (tx == null) throw new IllegalStateException("txRunner is required");
            return new JdbcMetadataStore(this);
        }
    }
}

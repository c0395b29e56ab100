package net.tickstore.adapter.jdbc.repo;

import net.tickstore.adapter.jdbc.JdbcUtil;
import net.tickstore.adapter.jdbc.SqlDialect;
import net.tickstore.adapter.jdbc.TxContext;
import net.tickstore.adapter.jdbc.mapper.UuidHalves;
import net.tickstore.core.error.CantAddException;
import net.tickstore.core.error.CantRemoveException;
import net.tickstore.core.error.FetchFailureException;
import net.tickstore.core.error.MappingException;
import net.tickstore.core.error.NotFoundException;
import net.tickstore.core.model.JobState;
import net.tickstore.core.model.NotificationData;
import net.tickstore.core.spi.NotificationStore;
import net.tickstore.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

public final class JdbcNotificationStore implements NotificationStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcNotificationStore.class);

    private final TxRunner tx;
    private volatile SqlDialect dialect;

    public JdbcNotificationStore(TxRunner tx) {
        this.tx = Objects.requireNonNull(tx, "txRunner");
    }

    private record NotificationRow(UUID id, UUID jobId, byte[] extra) {}

    @Override
    public NotificationData get(UUID id) throws FetchFailureException {
        NotificationRow row;
        List<Integer> stateCodes = new ArrayList<>();
        try {
            row = tx.required(() -> {
                Connection c = TxContext.require();
                NotificationRow found;
                try (PreparedStatement ps = c.prepareStatement(
                        "SELECT id, job_id, extra FROM notifications WHERE id = ?")) {
                    ps.setObject(1, id);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) return null;
                        found = new NotificationRow(
                                JdbcUtil.getUuid(rs, "id"), JdbcUtil.getUuid(rs, "job_id"), rs.getBytes("extra"));
                    }
                }
                try (PreparedStatement ps = c.prepareStatement(
                        "SELECT state FROM notification_states WHERE id = ? ORDER BY state")) {
                    ps.setObject(1, id);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) stateCodes.add(rs.getInt(1));
                    }
                }
                return found;
            });
        } catch (Exception e) {
            log.error("Failed to fetch notification {}: {}", id, e.getMessage());
            throw new FetchFailureException("Failed to fetch notification " + id, e);
        }

        if (row == null) {
            log.warn("Notification with id {} not found", id);
            throw new NotFoundException("Notification", id);
        }

        List<JobState> states = new ArrayList<>(stateCodes.size());
        try {
            for (int code : stateCodes) states.add(JobState.fromCode(code));
        } catch (MappingException e) {
            log.error("Notification {} carries an unknown state: {}", id, e.getMessage());
            throw new FetchFailureException("Failed to map notification " + id, e);
        }
        return new NotificationData(UuidHalves.split(row.jobId()), UuidHalves.split(row.id()), row.extra(), states);
    }

    @Override
    public void addOrUpdate(NotificationData data) throws CantAddException {
        if (data.notificationId() == null || data.jobId() == null) {
            log.error("Notification without id or job id: {}", data);
            throw new CantAddException("Notification requires both an id and a job id");
        }
        UUID id = UuidHalves.join(data.notificationId());
        UUID jobId = UuidHalves.join(data.jobId());
        Set<JobState> states = new LinkedHashSet<>(data.jobStates());

        try {
            tx.requiresNew(() -> {
                Connection c = TxContext.require();
                try (PreparedStatement ps = c.prepareStatement(dialect(c).upsertNotification())) {
                    ps.setObject(1, id);
                    ps.setObject(2, jobId);
                    JdbcUtil.setBytes(ps, 3, data.extra());
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = c.prepareStatement("DELETE FROM notification_states WHERE id = ?")) {
                    ps.setObject(1, id);
                    ps.executeUpdate();
                }
                if (!states.isEmpty()) {
                    try (PreparedStatement ps = c.prepareStatement(
                            "INSERT INTO notification_states (id, state) VALUES (?, ?)")) {
                        for (JobState s : states) {
                            ps.setObject(1, id);
                            ps.setInt(2, s.code());
                            ps.addBatch();
                        }
                        ps.executeBatch();
                    }
                }
                return null;
            });
        } catch (Exception e) {
            log.error("Failed to insert or update notification {} for job {}: {}", id, jobId, e.getMessage());
            throw new CantAddException("Failed to insert or update notification " + id, e);
        }
    }

    @Override
    public void delete(UUID id) throws CantRemoveException {
        try {
            update("DELETE FROM notifications WHERE id = ?", id);
        } catch (Exception e) {
            log.error("Failed to delete notification {}: {}", id, e.getMessage());
            throw new CantRemoveException("Failed to delete notification " + id, e);
        }
    }

    @Override
    public void deleteForJob(UUID jobId) throws CantRemoveException {
        try {
            int n = update("DELETE FROM notifications WHERE job_id = ?", jobId);
            log.debug("Deleted {} notifications for job {}", n, jobId);
        } catch (Exception e) {
            log.error("Failed to delete notifications for job {}: {}", jobId, e.getMessage());
            throw new CantRemoveException("Failed to delete notifications for job " + jobId, e);
        }
    }

    @Override
    public boolean deleteNotificationForState(UUID notificationId, JobState state) throws CantRemoveException {
        try {
            return tx.required(() -> {
                try (PreparedStatement ps = TxContext.require().prepareStatement(
                        "DELETE FROM notification_states WHERE id = ? AND state = ?")) {
                    ps.setObject(1, notificationId);
                    ps.setInt(2, state.code());
                    return ps.executeUpdate() > 0;
                }
            });
        } catch (Exception e) {
            log.error("Failed to delete state {} of notification {}: {}", state, notificationId, e.getMessage());
            throw new CantRemoveException("Failed to delete state " + state + " of notification " + notificationId, e);
        }
    }

    @Override
    public List<UUID> listNotificationGuidsForJobAndState(UUID jobId, JobState state) throws FetchFailureException {
        try {
            return tx.required(() -> {
                try (PreparedStatement ps = TxContext.require().prepareStatement("""
                        SELECT DISTINCT n.id
                          FROM notifications n
                          JOIN notification_states ns ON ns.id = n.id
                         WHERE n.job_id = ? AND ns.state = ?
                        """)) {
                    ps.setObject(1, jobId);
                    ps.setInt(2, state.code());
                    return readIds(ps);
                }
            });
        } catch (Exception e) {
            log.error("Failed to list notifications for job {} in state {}: {}", jobId, state, e.getMessage());
            throw new FetchFailureException("Failed to list notifications for job " + jobId, e);
        }
    }

    @Override
    public List<UUID> listNotificationGuidsForJobId(UUID jobId) throws FetchFailureException {
        try {
            return tx.required(() -> {
                try (PreparedStatement ps = TxContext.require().prepareStatement(
                        "SELECT DISTINCT id FROM notifications WHERE job_id = ?")) {
                    ps.setObject(1, jobId);
                    return readIds(ps);
                }
            });
        } catch (Exception e) {
            log.error("Failed to list notifications for job {}: {}", jobId, e.getMessage());
            throw new FetchFailureException("Failed to list notifications for job " + jobId, e);
        }
    }

    private int update(String sql, UUID id) throws Exception {
        return tx.required(() -> {
            try (PreparedStatement ps = TxContext.require().prepareStatement(sql)) {
                ps.setObject(1, id);
                return ps.executeUpdate();
            }
        });
    }

    private static List<UUID> readIds(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            List<UUID> out = new ArrayList<>();
            while (rs.next()) out.add(rs.getObject(1, UUID.class));
            return out;
        }
    }

    private SqlDialect dialect(Connection c) throws SQLException {
        SqlDialect d = dialect;
        if (d == null) {
            d = SqlDialect.of(c);
            dialect = d;
        }
        return d;
    }
}

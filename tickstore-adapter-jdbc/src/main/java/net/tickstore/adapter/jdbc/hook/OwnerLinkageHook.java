package net.tickstore.adapter.jdbc.hook;

import net.tickstore.adapter.jdbc.mapper.JobRow;
import net.tickstore.core.model.JobExtra;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.UUID;

/**
 * Keeps at most one job per (owner, extension type). Acts only on jobs whose extra payload carries
 * {@link #extensionType()}; jobs of other types pass through untouched.
 * <p>
 * The existence check and the insert run in different transactions, so two concurrent
 * registrations for the same owner can both pass the check.
 */
public class OwnerLinkageHook implements JobAddHook {
    private static final Logger log = LoggerFactory.getLogger(OwnerLinkageHook.class);

    private final int extensionType;

    public OwnerLinkageHook(int extensionType) {
        this.extensionType = extensionType;
    }

    public int extensionType() { return extensionType; }

    protected boolean handles(JobExtra extra) {
        return extra.extensionType() == extensionType;
    }

    @Override
    public boolean beforeAdd(JobRow job, JobExtra extra, Connection connection) throws Exception {
        if (!handles(extra)) return false;
        try (PreparedStatement ps = connection.prepareStatement("""
                SELECT 1
                  FROM job_extensions je
                  JOIN users_jobs uj ON uj.job_id = je.job_id
                 WHERE je.type = ? AND uj.user_id = ?
                 FETCH FIRST 1 ROWS ONLY
                """)) {
            ps.setInt(1, extensionType);
            ps.setObject(2, extra.ownerId());
            try (ResultSet rs = ps.executeQuery()) {
                boolean exists = rs.next();
                if (exists) {
                    log.info("User {} already has a job of extension type {}, skipping", extra.ownerId(), extensionType);
                }
                return exists;
            }
        }
    }

    @Override
    public void afterAdd(JobRow job, JobExtra extra, Connection transaction) throws Exception {
        if (!handles(extra)) return;
        try (PreparedStatement ps = transaction.prepareStatement(
                "INSERT INTO job_extensions (job_id, type) VALUES (?, ?)")) {
            ps.setObject(1, job.id());
            ps.setInt(2, extensionType);
            ps.executeUpdate();
        }
        try (PreparedStatement ps = transaction.prepareStatement(
                "INSERT INTO users_jobs (id, job_id, user_id) VALUES (?, ?, ?)")) {
            ps.setObject(1, UUID.randomUUID());
            ps.setObject(2, job.id());
            ps.setObject(3, extra.ownerId());
            ps.executeUpdate();
        }
        log.debug("Linked job {} to user {} (extension type {})", job.id(), extra.ownerId(), extensionType);
    }
}

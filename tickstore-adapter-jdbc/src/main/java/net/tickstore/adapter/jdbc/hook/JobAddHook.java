package net.tickstore.adapter.jdbc.hook;

import net.tickstore.adapter.jdbc.mapper.JobRow;
import net.tickstore.core.model.JobExtra;

import java.sql.Connection;

/**
 * Extension points around a job insert. Domain code implements this to attach its own rows to a
 * job, or to refuse a job it already has, without changing the metadata store.
 */
public interface JobAddHook {

    /**
     * Read-only check run before any write transaction is opened.
     *
     * @return true when the job is already satisfied and nothing should be written
     */
    boolean beforeAdd(JobRow job, JobExtra extra, Connection connection) throws Exception;

    /**
     * Runs inside the write transaction, after the job row has been upserted and before commit.
     * Throwing rolls back the job row as well.
     */
    void afterAdd(JobRow job, JobExtra extra, Connection transaction) throws Exception;
}

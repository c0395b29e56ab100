package net.tickstore.core.spi;

import net.tickstore.core.model.JobStoredData;

/**
 * The external tick engine the stores plug into. It owns the tick loop and decides when
 * jobs are persisted through {@link MetadataStore} and {@link NotificationStore}.
 */
public interface SchedulerEngine {
    void start() throws Exception;

    /** Registers a job; the engine persists it through its metadata store. */
    void add(JobStoredData job) throws Exception;

    void shutdown() throws Exception;
}

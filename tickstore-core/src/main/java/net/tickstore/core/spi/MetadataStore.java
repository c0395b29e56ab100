package net.tickstore.core.spi;

import net.tickstore.core.error.FetchFailureException;
import net.tickstore.core.error.UpdateFailureException;
import net.tickstore.core.model.JobAndNextTick;
import net.tickstore.core.model.JobStoredData;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MetadataStore extends DataStore<JobStoredData> {

    /** Jobs whose next tick lies in {@code (0, now]}, in no particular order. */
    List<JobAndNextTick> listNextTicks(Instant now) throws FetchFailureException;

    List<JobAndNextTick> listNextTicks() throws FetchFailureException;

    /** A {@code null} next tick is stored as 0 (unscheduled). */
    void setNextAndLastTick(UUID id, Instant nextTick, Instant lastTick) throws UpdateFailureException;

    /** Time until the earliest job scheduled after now, or empty when nothing is scheduled. */
    Optional<Duration> timeTillNextJob() throws FetchFailureException;
}

package net.tickstore.core.spi;

import net.tickstore.core.error.CantRemoveException;
import net.tickstore.core.error.FetchFailureException;
import net.tickstore.core.model.JobState;
import net.tickstore.core.model.NotificationData;

import java.util.List;
import java.util.UUID;

public interface NotificationStore extends DataStore<NotificationData> {

    void deleteForJob(UUID jobId) throws CantRemoveException;

    /** @return true when a state marker was actually removed */
    boolean deleteNotificationForState(UUID notificationId, JobState state) throws CantRemoveException;

    List<UUID> listNotificationGuidsForJobAndState(UUID jobId, JobState state) throws FetchFailureException;

    List<UUID> listNotificationGuidsForJobId(UUID jobId) throws FetchFailureException;
}

package net.tickstore.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/** A notification registered by the engine for a job, with the states it fires on. */
public record NotificationData(
        JobUuid jobId,
        JobUuid notificationId,
        byte[] extra,
        List<JobState> jobStates
) {
    public NotificationData {
        extra = extra == null ? new byte[0] : extra;
        jobStates = jobStates == null ? List.of() : List.copyOf(jobStates);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NotificationData that)) return false;
        return Objects.equals(jobId, that.jobId)
                && Objects.equals(notificationId, that.notificationId)
                && Arrays.equals(extra, that.extra)
                && Objects.equals(jobStates, that.jobStates);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(jobId, notificationId, jobStates) + Arrays.hashCode(extra);
    }

    @Override
    public String toString() {
        return "NotificationData{jobId=" + jobId + ", notificationId=" + notificationId
                + ", jobStates=" + jobStates + ", extra=" + extra.length + " bytes}";
    }
}

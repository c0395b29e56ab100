package net.tickstore.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * The scheduler engine's in-memory job descriptor.
 * <p>
 * {@code nextTick} and {@code lastTick} are epoch seconds; a {@code nextTick} of 0 means
 * the job is not scheduled. {@code job} carries either a cron schedule or a repeat interval,
 * selected by {@code jobType}.
 */
public record JobStoredData(
        JobUuid id,
        Long lastUpdated,
        long nextTick,
        Long lastTick,
        int jobType,
        int count,
        boolean ran,
        boolean stopped,
        int timeOffsetSeconds,
        byte[] extra,
        JobSpec job
) {
    public JobStoredData {
        extra = extra == null ? new byte[0] : extra;
    }

    public interface JobSpec {}

    public record CronJob(String schedule) implements JobSpec {}

    public record NonCronJob(boolean repeating, long repeatedEvery) implements JobSpec {}

    public static JobStoredData cron(JobUuid id, String schedule, long nextTick, byte[] extra) {
        return new JobStoredData(id, null, nextTick, null, JobType.CRON.code(),
                0, false, false, 0, extra, new CronJob(schedule));
    }

    public JobStoredData withExtra(byte[] newExtra) {
        return new JobStoredData(id, lastUpdated, nextTick, lastTick, jobType, count, ran, stopped,
                timeOffsetSeconds, newExtra, job);
    }

    // extra is compared by content, not identity
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobStoredData that)) return false;
        return nextTick == that.nextTick
                && jobType == that.jobType
                && count == that.count
                && ran == that.ran
                && stopped == that.stopped
                && timeOffsetSeconds == that.timeOffsetSeconds
                && Objects.equals(id, that.id)
                && Objects.equals(lastUpdated, that.lastUpdated)
                && Objects.equals(lastTick, that.lastTick)
                && Arrays.equals(extra, that.extra)
                && Objects.equals(job, that.job);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(id, lastUpdated, nextTick, lastTick, jobType, count, ran, stopped,
                timeOffsetSeconds, job);
        return 31 * h + Arrays.hashCode(extra);
    }

    @Override
    public String toString() {
        return "JobStoredData{" +
                "id=" + id +
                ", jobType=" + jobType +
                ", nextTick=" + nextTick +
                ", lastTick=" + lastTick +
                ", count=" + count +
                ", ran=" + ran +
                ", stopped=" + stopped +
                ", job=" + job +
                ", extra=" + extra.length + " bytes" +
                '}';
    }
}

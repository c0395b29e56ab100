package net.tickstore.adapter.jdbc.mapper;

import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/** One row of the {@code jobs} table. */
public record JobRow(
        UUID id,
        Long lastUpdated,
        Long nextTick,
        Long lastTick,
        int jobType,
        Integer count,
        Boolean ran,
        Boolean stopped,
        Integer timeOffsetSeconds,
        byte[] extra,
        String schedule,
        Long repeatedEvery,
        Boolean repeating
) {
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobRow that)) return false;
        return jobType == that.jobType
                && Objects.equals(id, that.id)
                && Objects.equals(lastUpdated, that.lastUpdated)
                && Objects.equals(nextTick, that.nextTick)
                && Objects.equals(lastTick, that.lastTick)
                && Objects.equals(count, that.count)
                && Objects.equals(ran, that.ran)
                && Objects.equals(stopped, that.stopped)
                && Objects.equals(timeOffsetSeconds, that.timeOffsetSeconds)
                && Arrays.equals(extra, that.extra)
                && Objects.equals(schedule, that.schedule)
                && Objects.equals(repeatedEvery, that.repeatedEvery)
                && Objects.equals(repeating, that.repeating);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(id, lastUpdated, nextTick, lastTick, jobType, count, ran, stopped,
                timeOffsetSeconds, schedule, repeatedEvery, repeating);
        return 31 * h + Arrays.hashCode(extra);
    }

    @Override
    public String toString() {
        return "JobRow{id=" + id + ", jobType=" + jobType + ", nextTick=" + nextTick
                + ", lastTick=" + lastTick + ", schedule='" + schedule + "', repeatedEvery=" + repeatedEvery
                + ", repeating=" + repeating + '}';
    }
}

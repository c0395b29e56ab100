package net.tickstore.adapter.jdbc.mapper;

import net.tickstore.core.error.MappingException;
import net.tickstore.core.model.JobStoredData;
import net.tickstore.core.model.JobStoredData.CronJob;
import net.tickstore.core.model.JobStoredData.NonCronJob;
import net.tickstore.core.model.JobType;

/**
 * Converts the engine's job descriptor to a {@code jobs} row and back. The two directions are
 * inverses for every valid descriptor.
 */
public final class JobRecordMapper {
    private JobRecordMapper() {}

    public static JobRow toRow(JobStoredData d) throws MappingException {
        if (d.id() == null) {
            throw new MappingException("Job descriptor has no id");
        }
        JobType type = JobType.fromCode(d.jobType());

        String schedule = null;
        Long repeatedEvery = null;
        Boolean repeating = null;
        if (type.isCron()) {
            if (!(d.job() instanceof CronJob cron) || cron.schedule() == null) {
                throw new MappingException("Cron job " + UuidHalves.join(d.id()) + " has no schedule");
            }
            schedule = cron.schedule();
        } else {
            if (!(d.job() instanceof NonCronJob nonCron)) {
                throw new MappingException("Job " + UuidHalves.join(d.id()) + " of type " + type
                        + " has no repeat settings");
            }
            repeating = nonCron.repeating();
            repeatedEvery = nonCron.repeatedEvery();
        }

        return new JobRow(
                UuidHalves.join(d.id()),
                d.lastUpdated(),
                d.nextTick(),
                d.lastTick(),
                type.code(),
                d.count(),
                d.ran(),
                d.stopped(),
                d.timeOffsetSeconds(),
                d.extra(),
                schedule,
                repeatedEvery,
                repeating
        );
    }

    public static JobStoredData toDescriptor(JobRow row) throws MappingException {
        JobType type = JobType.fromCode(row.jobType());

        JobStoredData.JobSpec spec;
        if (type.isCron()) {
            if (row.schedule() == null) {
                throw new MappingException("Cron job " + row.id() + " is stored without a schedule");
            }
            spec = new CronJob(row.schedule());
        } else {
            spec = new NonCronJob(
                    row.repeating() != null && row.repeating(),
                    row.repeatedEvery() == null ? 0L : row.repeatedEvery());
        }

        return new JobStoredData(
                UuidHalves.split(row.id()),
                row.lastUpdated(),
                row.nextTick() == null ? 0L : row.nextTick(),
                row.lastTick(),
                type.code(),
                row.count() == null ? 0 : row.count(),
                row.ran() != null && row.ran(),
                row.stopped() != null && row.stopped(),
                row.timeOffsetSeconds() == null ? 0 : row.timeOffsetSeconds(),
                row.extra(),
                spec
        );
    }
}

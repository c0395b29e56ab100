package net.tickstore.app.reminder;

import net.tickstore.adapter.jdbc.mapper.UuidHalves;
import net.tickstore.core.codec.JobExtraCodec;
import net.tickstore.core.model.JobExtra;
import net.tickstore.core.model.JobStoredData;
import net.tickstore.core.spi.Clock;
import net.tickstore.core.spi.CronCalculator;
import net.tickstore.core.spi.SchedulerEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.util.UUID;

/**
 * Registers per-user cron reminder jobs with the engine. A user who already holds a job of the
 * same kind is left as is; the store's linkage hook drops the duplicate.
 */
public class ReminderScheduler {
    private static final Logger log = LoggerFactory.getLogger(ReminderScheduler.class);

    private final SchedulerEngine engine;
    private final CronCalculator cron;
    private final Clock clock;
    private final JobExtraCodec codec;
    private final ZoneId zone;
    private final String whiteDaysCron;
    private final String dailyHadithCron;

    public ReminderScheduler(SchedulerEngine engine, CronCalculator cron, Clock clock, JobExtraCodec codec,
                             ZoneId zone, String whiteDaysCron, String dailyHadithCron) {
        this.engine = engine;
        this.cron = cron;
        this.clock = clock;
        this.codec = codec;
        this.zone = zone;
        this.whiteDaysCron = whiteDaysCron;
        this.dailyHadithCron = dailyHadithCron;
    }

    /** Checked every evening; the message itself only goes out the day before the white days. */
    public void scheduleWhiteDaysMessage(UUID ownerId) throws ReminderException {
        schedule(ExtensionType.WHITE_DAYS_MESSAGE, whiteDaysCron, ownerId);
    }

    public void scheduleDailyHadith(UUID ownerId) throws ReminderException {
        schedule(ExtensionType.DAILY_HADITH_MESSAGE, dailyHadithCron, ownerId);
    }

    private void schedule(ExtensionType type, String cronExpr, UUID ownerId) throws ReminderException {
        JobStoredData job;
        try {
            Instant next = cron.next(clock.now(), cronExpr, zone);
            byte[] extra = codec.encode(new JobExtra(ownerId, type.code()));
            job = JobStoredData.cron(UuidHalves.split(UUID.randomUUID()), cronExpr, next.getEpochSecond(), extra);
        } catch (Exception e) {
            log.error("Failed to create {} job for user {}: {}", type, ownerId, e.getMessage());
            throw new ReminderException("Failed to create " + type + " job", e);
        }

        try {
            engine.add(job);
        } catch (Exception e) {
            log.error("Failed to schedule {} job for user {}: {}", type, ownerId, e.getMessage());
            throw new ReminderException("Failed to schedule " + type + " job", e);
        }
        log.info("{} job scheduled for user {} ({})", type, ownerId, cronExpr);
    }
}

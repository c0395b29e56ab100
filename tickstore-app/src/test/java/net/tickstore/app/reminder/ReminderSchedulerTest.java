package net.tickstore.app.reminder;

import net.tickstore.core.codec.JobExtraCodec;
import net.tickstore.core.model.JobExtra;
import net.tickstore.core.model.JobStoredData;
import net.tickstore.core.model.JobType;
import net.tickstore.core.spi.SchedulerEngine;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReminderSchedulerTest {

    static final Instant NOW = Instant.parse("2024-03-01T07:00:00Z");

    final JobExtraCodec codec = new JobExtraCodec();
    final List<JobStoredData> added = new ArrayList<>();
    boolean engineFails;

    final SchedulerEngine engine = new SchedulerEngine() {
        @Override public void start() {}
        @Override public void shutdown() {}

        @Override
        public void add(JobStoredData job) {
            if (engineFails) throw new IllegalStateException("engine stopped");
            added.add(job);
        }
    };

    // every cron fires one hour after "from"
    final ReminderScheduler scheduler = new ReminderScheduler(engine,
            (from, expr, zone) -> from.plusSeconds(3600), () -> NOW, codec, ZoneOffset.UTC,
            "0 0 18 * * *", "0 0 8 * * *");

    @Test
    void dailyHadith_buildsCronJobOwnedByUser() throws Exception {
        UUID owner = UUID.randomUUID();

        scheduler.scheduleDailyHadith(owner);

        assertThat(added).hasSize(1);
        JobStoredData job = added.get(0);
        assertThat(job.jobType()).isEqualTo(JobType.CRON.code());
        assertThat(job.job()).isEqualTo(new JobStoredData.CronJob("0 0 8 * * *"));
        assertThat(job.nextTick()).isEqualTo(NOW.getEpochSecond() + 3600);
        assertThat(codec.decode(job.extra()))
                .isEqualTo(new JobExtra(owner, ExtensionType.DAILY_HADITH_MESSAGE.code()));
    }

    @Test
    void whiteDays_usesItsOwnScheduleAndType() throws Exception {
        UUID owner = UUID.randomUUID();

        scheduler.scheduleWhiteDaysMessage(owner);
        scheduler.scheduleWhiteDaysMessage(owner);

        assertThat(added).hasSize(2);
        assertThat(added.get(0).id()).isNotEqualTo(added.get(1).id());
        assertThat(added.get(0).job()).isEqualTo(new JobStoredData.CronJob("0 0 18 * * *"));
        assertThat(codec.decode(added.get(0).extra()).extensionType())
                .isEqualTo(ExtensionType.WHITE_DAYS_MESSAGE.code());
    }

    @Test
    void engineFailure_becomesReminderException() {
        engineFails = true;

        assertThatThrownBy(() -> scheduler.scheduleDailyHadith(UUID.randomUUID()))
                .isInstanceOf(ReminderException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}

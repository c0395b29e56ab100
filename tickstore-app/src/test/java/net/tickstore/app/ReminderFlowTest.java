package net.tickstore.app;

import net.tickstore.app.external.HadithSource;
import net.tickstore.app.external.HijriCalendar;
import net.tickstore.app.external.HijriDate;
import net.tickstore.app.reminder.ExtensionType;
import net.tickstore.app.reminder.ReminderDispatcher;
import net.tickstore.app.reminder.ReminderScheduler;
import net.tickstore.core.model.JobAndNextTick;
import net.tickstore.core.model.JobStoredData;
import net.tickstore.core.service.SchedulerRuntime;
import net.tickstore.core.spi.Clock;
import net.tickstore.core.spi.CronCalculator;
import net.tickstore.core.spi.MessageSink;
import net.tickstore.core.spi.MetadataStore;
import net.tickstore.core.spi.OwnerRegistry;
import net.tickstore.core.spi.SchedulerEngine;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ReminderFlowTest {

    static final Map<Long, String> sent = new ConcurrentHashMap<>();

    /** Minimal tick engine over the metadata store, polling every 100 ms. */
    static class StoreBackedEngine implements SchedulerEngine {
        private static final Logger log = LoggerFactory.getLogger(StoreBackedEngine.class);

        private final MetadataStore store;
        private final ObjectProvider<ReminderDispatcher> dispatcher;
        private final CronCalculator cron;
        private final Clock clock;
        private final ZoneId zone;
        private ScheduledExecutorService loop;

        StoreBackedEngine(MetadataStore store, ObjectProvider<ReminderDispatcher> dispatcher,
                          CronCalculator cron, Clock clock, ZoneId zone) {
            this.store = store;
            this.dispatcher = dispatcher;
            this.cron = cron;
            this.clock = clock;
            this.zone = zone;
        }

        @Override
        public void start() {
            loop = Executors.newSingleThreadScheduledExecutor();
            loop.scheduleWithFixedDelay(this::tick, 0, 100, TimeUnit.MILLISECONDS);
        }

        @Override
        public void add(JobStoredData job) throws Exception {
            store.addOrUpdate(job);
        }

        @Override
        public void shutdown() {
            loop.shutdownNow();
        }

        void tick() {
            try {
                Instant now = clock.now();
                for (JobAndNextTick due : store.listNextTicks(now)) {
                    JobStoredData job = store.get(due.id());
                    dispatcher.getObject().dispatch(job);
                    String expr = ((JobStoredData.CronJob) job.job()).schedule();
                    store.setNextAndLastTick(due.id(), cron.next(now, expr, zone), now);
                }
            } catch (Exception e) {
                log.error("tick failed", e);
            }
        }
    }

    @TestConfiguration
    static class Collaborators {
        @Bean
        SchedulerEngine engine(MetadataStore store, ObjectProvider<ReminderDispatcher> dispatcher,
                               CronCalculator cron, Clock clock, ZoneId zone) {
            return new StoreBackedEngine(store, dispatcher, cron, clock, zone);
        }

        @Bean
        MessageSink sink() { return sent::put; }

        @Bean
        HadithSource hadithSource() { return () -> "The best of you are those who learn the Quran and teach it."; }

        @Bean
        HijriCalendar hijriCalendar() { return () -> new HijriDate(12, 8, "Sha'ban", 1446); }
    }

    @Autowired JdbcTemplate jdbc;
    @Autowired OwnerRegistry owners;
    @Autowired ReminderScheduler reminders;
    @Autowired ReminderDispatcher dispatcher;
    @Autowired SchedulerRuntime runtime;

    @BeforeEach
    void clean() {
        sent.clear();
        for (String t : new String[]{"notification_states", "notifications", "users_jobs", "job_extensions", "jobs", "users"}) {
            jdbc.update("DELETE FROM " + t);
        }
    }

    private int count(String sql, Object... args) {
        return jdbc.queryForObject(sql, Integer.class, args);
    }

    @Test
    void engineRunsWithContext() {
        assertThat(runtime.isRunning()).isTrue();
    }

    @Test
    void repeatedRegistration_keepsOneJobPerUser_andDueJobsAreDelivered() throws Exception {
        UUID u1 = owners.register(1001L, "u1");
        UUID u2 = owners.register(1002L, "u2");

        reminders.scheduleDailyHadith(u1);
        reminders.scheduleDailyHadith(u1);
        reminders.scheduleDailyHadith(u2);
        reminders.scheduleWhiteDaysMessage(u1);

        assertThat(count("SELECT COUNT(*) FROM jobs")).isEqualTo(3);
        assertThat(count("SELECT COUNT(*) FROM job_extensions WHERE type = 2")).isEqualTo(2);
        assertThat(count("""
                SELECT COUNT(*) FROM users_jobs uj JOIN job_extensions je ON je.job_id = uj.job_id
                 WHERE uj.user_id = ? AND je.type = 2""", u1)).isEqualTo(1);

        // make the daily hadith jobs due now
        jdbc.update("UPDATE jobs SET next_tick = 1 WHERE id IN (SELECT job_id FROM job_extensions WHERE type = 2)");

        Awaitility.await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
            assertThat(sent).containsOnlyKeys(1001L, 1002L);
            assertThat(sent.get(1001L)).startsWith("The best of you");
        });
        Awaitility.await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(count("SELECT COUNT(*) FROM jobs WHERE next_tick > ? AND last_tick IS NOT NULL",
                        Instant.now().getEpochSecond() - 60)).isEqualTo(2));
    }

    @Test
    void whiteDaysBroadcast_usesTranslatedText() throws Exception {
        UUID u = owners.register(2001L, "w");
        reminders.scheduleWhiteDaysMessage(u);

        dispatcher.broadcast(ExtensionType.WHITE_DAYS_MESSAGE);

        assertThat(sent).containsOnlyKeys(2001L);
        assertThat(sent.get(2001L)).contains("Sha'ban").contains("white days");
    }
}

package net.tickstore.app.config;

import net.tickstore.app.external.HadithSource;
import net.tickstore.app.external.HijriCalendar;
import net.tickstore.app.external.MessageSourceTranslator;
import net.tickstore.app.external.Translator;
import net.tickstore.app.reminder.DailyHadithNotifier;
import net.tickstore.app.reminder.ExtensionLinkageHook;
import net.tickstore.app.reminder.ReminderDispatcher;
import net.tickstore.app.reminder.ReminderNotifier;
import net.tickstore.app.reminder.ReminderScheduler;
import net.tickstore.app.reminder.WhiteDaysNotifier;
import net.tickstore.bootstrap.autoconfigure.TickStoreAutoConfiguration;
import net.tickstore.bootstrap.props.TickStoreProperties;
import net.tickstore.core.codec.JobExtraCodec;
import net.tickstore.core.service.DeliveryFanOut;
import net.tickstore.core.spi.Clock;
import net.tickstore.core.spi.CronCalculator;
import net.tickstore.core.spi.MessageSink;
import net.tickstore.core.spi.OwnerRegistry;
import net.tickstore.core.spi.SchedulerEngine;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.MessageSource;
import org.springframework.context.annotation.Bean;

import java.time.ZoneId;
import java.util.Locale;

/**
 * Reminder wiring. Notifiers appear once their collaborators (calendar or hadith source, and a
 * message sink) are provided; scheduling needs an engine.
 */
@AutoConfiguration(after = TickStoreAutoConfiguration.class)
public class ReminderAutoConfiguration {

    @Bean
    public ExtensionLinkageHook extensionLinkageHook() {
        return new ExtensionLinkageHook();
    }

    @Bean
    @ConditionalOnMissingBean
    public Translator translator(MessageSource messageSource) {
        return new MessageSourceTranslator(messageSource, Locale.ROOT);
    }

    @Bean
    @ConditionalOnBean({HijriCalendar.class, MessageSink.class})
    public WhiteDaysNotifier whiteDaysNotifier(HijriCalendar calendar, Translator translator, MessageSink sink,
                                               DeliveryFanOut fanOut) {
        return new WhiteDaysNotifier(calendar, translator, sink, fanOut);
    }

    @Bean
    @ConditionalOnBean({HadithSource.class, MessageSink.class})
    public DailyHadithNotifier dailyHadithNotifier(HadithSource source, Translator translator, MessageSink sink,
                                                   DeliveryFanOut fanOut) {
        return new DailyHadithNotifier(source, translator, sink, fanOut);
    }

    @Bean
    public ReminderDispatcher reminderDispatcher(OwnerRegistry owners, JobExtraCodec codec,
                                                 ObjectProvider<ReminderNotifier> notifiers) {
        return new ReminderDispatcher(owners, codec, notifiers.orderedStream().toList());
    }

    @Bean
    @ConditionalOnBean(SchedulerEngine.class)
    public ReminderScheduler reminderScheduler(SchedulerEngine engine, CronCalculator cron, Clock clock,
                                               JobExtraCodec codec, ZoneId zone, TickStoreProperties props) {
        return new ReminderScheduler(engine, cron, clock, codec, zone,
                props.getReminders().getWhiteDaysCron(), props.getReminders().getDailyHadithCron());
    }
}

package net.tickstore.app.reminder;

import net.tickstore.app.external.HijriCalendar;
import net.tickstore.app.external.HijriDate;
import net.tickstore.app.external.Translator;
import net.tickstore.core.service.DeliveryFanOut;
import net.tickstore.core.service.DeliveryFanOut.DeliveryReport;
import net.tickstore.core.spi.MessageSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Evening check for the white days (13th to 15th of each Hijri month). On the 12th the users are
 * told the white days start tomorrow; Ramadan is skipped.
 */
public class WhiteDaysNotifier implements ReminderNotifier {
    private static final Logger log = LoggerFactory.getLogger(WhiteDaysNotifier.class);

    static final int DAY_BEFORE_FIRST_WHITE_DAY = 12;
    static final int RAMADAN = 9;

    private final HijriCalendar calendar;
    private final Translator translator;
    private final MessageSink sink;
    private final DeliveryFanOut fanOut;

    public WhiteDaysNotifier(HijriCalendar calendar, Translator translator, MessageSink sink, DeliveryFanOut fanOut) {
        this.calendar = calendar;
        this.translator = translator;
        this.sink = sink;
        this.fanOut = fanOut;
    }

    @Override
    public ExtensionType type() { return ExtensionType.WHITE_DAYS_MESSAGE; }

    @Override
    public DeliveryReport notify(Collection<Long> chatIds) throws InterruptedException {
        HijriDate today;
        try {
            today = calendar.today();
        } catch (Exception e) {
            log.error("Current Hijri date fetch error: {}", e.getMessage());
            return new DeliveryReport(0, 0, 0);
        }

        if (today.day() != DAY_BEFORE_FIRST_WHITE_DAY || today.month() == RAMADAN) {
            log.info("Current Hijri date is {}, not sending white days message", today);
            return new DeliveryReport(0, 0, 0);
        }

        String text = translator.translate(Translator.WHITE_DAYS_NOTIFICATION, today.monthName());
        return fanOut.deliver("white-days", chatIds, chatId -> sink.send(chatId, text));
    }
}

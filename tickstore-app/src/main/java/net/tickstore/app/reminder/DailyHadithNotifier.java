package net.tickstore.app.reminder;

import net.tickstore.app.external.HadithSource;
import net.tickstore.app.external.Translator;
import net.tickstore.core.service.DeliveryFanOut;
import net.tickstore.core.service.DeliveryFanOut.DeliveryReport;
import net.tickstore.core.spi.MessageSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

public class DailyHadithNotifier implements ReminderNotifier {
    private static final Logger log = LoggerFactory.getLogger(DailyHadithNotifier.class);

    private final HadithSource source;
    private final Translator translator;
    private final MessageSink sink;
    private final DeliveryFanOut fanOut;

    public DailyHadithNotifier(HadithSource source, Translator translator, MessageSink sink, DeliveryFanOut fanOut) {
        this.source = source;
        this.translator = translator;
        this.sink = sink;
        this.fanOut = fanOut;
    }

    @Override
    public ExtensionType type() { return ExtensionType.DAILY_HADITH_MESSAGE; }

    @Override
    public DeliveryReport notify(Collection<Long> chatIds) throws InterruptedException {
        String text;
        try {
            text = source.randomHadith();
        } catch (Exception e) {
            log.error("Failed to fetch daily hadith: {}", e.getMessage());
            text = translator.translate(Translator.GENERIC_ERROR);
        }
        String message = text;
        return fanOut.deliver("daily-hadith", chatIds, chatId -> sink.send(chatId, message));
    }
}

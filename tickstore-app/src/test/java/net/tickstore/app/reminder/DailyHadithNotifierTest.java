package net.tickstore.app.reminder;

import net.tickstore.app.external.Translator;
import net.tickstore.core.service.DeliveryFanOut;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class DailyHadithNotifierTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final DeliveryFanOut fanOut = new DeliveryFanOut(executor);
    private final Map<Long, String> sent = new ConcurrentHashMap<>();
    private final Translator translator = (key, args) -> "[" + key + "]";

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void sendsTheSameHadithToEveryone() throws Exception {
        DailyHadithNotifier notifier = new DailyHadithNotifier(() -> "Actions are judged by intentions.",
                translator, sent::put, fanOut);

        assertThat(notifier.notify(List.of(5L, 6L)).delivered()).isEqualTo(2);
        assertThat(sent).containsEntry(5L, "Actions are judged by intentions.")
                .containsEntry(6L, "Actions are judged by intentions.");
    }

    @Test
    void sourceFailure_sendsGenericError() throws Exception {
        DailyHadithNotifier notifier = new DailyHadithNotifier(() -> {
            throw new IllegalStateException("hadith table empty");
        }, translator, sent::put, fanOut);

        notifier.notify(List.of(5L));

        assertThat(sent).containsEntry(5L, "[generic_error]");
    }
}

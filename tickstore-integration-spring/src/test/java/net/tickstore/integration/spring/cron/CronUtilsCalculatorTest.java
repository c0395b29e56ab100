package net.tickstore.integration.spring.cron;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronUtilsCalculatorTest {

    private final CronUtilsCalculator cron = new CronUtilsCalculator();

    @Test
    void next_sameDay_andRollsOverToTomorrow() {
        Instant morning = Instant.parse("2024-03-01T07:00:00Z");
        assertThat(cron.next(morning, "0 0 8 * * *", ZoneOffset.UTC))
                .isEqualTo(Instant.parse("2024-03-01T08:00:00Z"));

        Instant evening = Instant.parse("2024-03-01T20:00:00Z");
        assertThat(cron.next(evening, "0 0 8 * * *", ZoneOffset.UTC))
                .isEqualTo(Instant.parse("2024-03-02T08:00:00Z"));
    }

    @Test
    void next_isEvaluatedInTheGivenZone() {
        // 18:00 in Riyadh (UTC+3) is 15:00Z
        Instant from = Instant.parse("2024-03-01T10:00:00Z");
        assertThat(cron.next(from, "0 0 18 * * *", ZoneId.of("Asia/Riyadh")))
                .isEqualTo(Instant.parse("2024-03-01T15:00:00Z"));
    }

    @Test
    void malformedExpression_isRejected() {
        assertThatThrownBy(() -> cron.validate("every day at eight"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cron.next(Instant.EPOCH, "61 * * * * *", ZoneOffset.UTC))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

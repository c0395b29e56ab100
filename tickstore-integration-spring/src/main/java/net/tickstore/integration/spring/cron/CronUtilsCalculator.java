package net.tickstore.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import net.tickstore.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Six-field (seconds first) cron expressions, as used by the reminder schedules. */
public final class CronUtilsCalculator implements CronCalculator {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));

    // LRU of parsed expressions
    private final Map<String, ExecutionTime> cache = new LruMap<>(256);

    @Override
    public Instant next(Instant from, String cronExpr, ZoneId zone) {
        Objects.requireNonNull(cronExpr); Objects.requireNonNull(zone); Objects.requireNonNull(from);

        ExecutionTime et;
        synchronized (cache) {
            et = cache.computeIfAbsent(cronExpr, expr -> ExecutionTime.forCron(PARSER.parse(expr)));
        }
        var base = from.atZone(zone);
        return et.nextExecution(base)
                .orElseThrow(() -> new IllegalStateException("No next execution for [" + cronExpr + "] at " + base))
                .toInstant();
    }

    /** Fails fast on a malformed expression. */
    public void validate(String cronExpr) {
        PARSER.parse(cronExpr).validate();
    }

    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}

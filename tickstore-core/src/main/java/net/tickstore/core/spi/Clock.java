package net.tickstore.core.spi;

import java.time.Instant;

@FunctionalInterface
public interface Clock {
    Instant now();

    default long epochSeconds() { return now().getEpochSecond(); }
}

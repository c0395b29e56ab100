package net.tickstore.core.model;

import java.util.UUID;

public record JobAndNextTick(
        UUID id,
        long nextTick,
        int jobType,
        Long lastTick
) {
}

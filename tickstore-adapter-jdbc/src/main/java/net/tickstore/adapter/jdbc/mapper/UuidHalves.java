package net.tickstore.adapter.jdbc.mapper;

import net.tickstore.core.model.JobUuid;

import java.nio.ByteBuffer;
import java.util.UUID;

/** Converts between the engine's two-half identifier and {@link UUID}. */
public final class UuidHalves {
    private UuidHalves() {}

    /** Rebuilds the 16 bytes big-endian: {@code id1} then {@code id2}. */
    public static UUID join(JobUuid wire) {
        ByteBuffer bytes = ByteBuffer.allocate(16);
        bytes.putLong(wire.id1()).putLong(wire.id2()).flip();
        return new UUID(bytes.getLong(), bytes.getLong());
    }

    public static JobUuid split(UUID id) {
        return new JobUuid(id.getMostSignificantBits(), id.getLeastSignificantBits());
    }
}

package net.tickstore.core.model;

import java.util.UUID;

/**
 * Domain metadata carried in a job's extra payload: who owns the job and which
 * extension type it was created for. The store treats {@code extensionType} as an opaque tag.
 */
public record JobExtra(UUID ownerId, int extensionType) {
}

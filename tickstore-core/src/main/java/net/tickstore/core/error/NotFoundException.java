package net.tickstore.core.error;

import java.util.UUID;

public class NotFoundException extends FetchFailureException {
    private final UUID id;

    public NotFoundException(String what, UUID id) {
        super(ErrorKind.NOT_FOUND, what + " not found: " + id, null);
        this.id = id;
    }

    public UUID id() { return id; }
}

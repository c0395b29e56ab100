package net.tickstore.core.error;

/**
 * Base of the store's failure taxonomy. Every store operation reports failures through a
 * subtype of this exception; none of them are retried by the store itself.
 */
public abstract class JobStoreException extends Exception {
    private final ErrorKind kind;

    protected JobStoreException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() { return kind; }
}

package net.tickstore.core.error;

public class CantRemoveException extends JobStoreException {
    public CantRemoveException(String message) { this(message, null); }

    public CantRemoveException(String message, Throwable cause) { super(ErrorKind.CANT_REMOVE, message, cause); }
}

package net.tickstore.core.error;

/** Writing a job or notification failed, including validation and hook failures. */
public class CantAddException extends JobStoreException {
    public CantAddException(String message) { this(message, null); }

    public CantAddException(String message, Throwable cause) { super(ErrorKind.CANT_ADD, message, cause); }
}

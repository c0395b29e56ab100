package net.tickstore.core.error;

/** Tick bookkeeping could not be written. */
public class UpdateFailureException extends JobStoreException {
    public UpdateFailureException(String message) { this(message, null); }

    public UpdateFailureException(String message, Throwable cause) { super(ErrorKind.UPDATE_FAILURE, message, cause); }
}

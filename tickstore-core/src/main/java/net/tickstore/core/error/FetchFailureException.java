package net.tickstore.core.error;

/** Reading a job or notification failed. */
public class FetchFailureException extends JobStoreException {
    public FetchFailureException(String message) { this(message, null); }

    public FetchFailureException(String message, Throwable cause) { super(ErrorKind.FETCH_FAILURE, message, cause); }

    protected FetchFailureException(ErrorKind kind, String message, Throwable cause) { super(kind, message, cause); }
}

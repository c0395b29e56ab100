package net.tickstore.core.error;

/** A row or descriptor could not be converted. */
public class MappingException extends JobStoreException {
    public MappingException(String message) { this(message, null); }

    public MappingException(String message, Throwable cause) { super(ErrorKind.MAPPING_FAILURE, message, cause); }
}

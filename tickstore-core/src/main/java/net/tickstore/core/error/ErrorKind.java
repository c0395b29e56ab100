package net.tickstore.core.error;

public enum ErrorKind {
    NOT_FOUND,
    FETCH_FAILURE,
    CANT_ADD,
    CANT_REMOVE,
    UPDATE_FAILURE,
    MAPPING_FAILURE
}

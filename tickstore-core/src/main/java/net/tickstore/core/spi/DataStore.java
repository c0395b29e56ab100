package net.tickstore.core.spi;

import net.tickstore.core.error.CantAddException;
import net.tickstore.core.error.CantRemoveException;
import net.tickstore.core.error.FetchFailureException;

import java.util.UUID;

/** Storage contract the scheduler engine expects for each kind of record it persists. */
public interface DataStore<T> {

    /**
     * @throws net.tickstore.core.error.NotFoundException if no record has this id
     * @throws FetchFailureException if the read fails or the stored row cannot be mapped
     */
    T get(UUID id) throws FetchFailureException;

    void addOrUpdate(T data) throws CantAddException;

    /** Removing an id that does not exist is not an error. */
    void delete(UUID id) throws CantRemoveException;

    /** Schema is managed by migrations; nothing to prepare at runtime. */
    default void init() {}

    default boolean inited() { return true; }
}

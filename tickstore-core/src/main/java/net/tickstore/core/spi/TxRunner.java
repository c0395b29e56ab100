package net.tickstore.core.spi;

import java.util.concurrent.Callable;

/**
 * Runs a body inside a transaction. Any exception thrown by the body rolls the transaction
 * back and is rethrown unchanged.
 */
public interface TxRunner {
    /** Joins the transaction already bound to the current thread, or opens one. */
    <T> T required(Callable<T> body) throws Exception;

    /** Always opens a fresh transaction, suspending any outer one until the body returns. */
    <T> T requiresNew(Callable<T> body) throws Exception;
}

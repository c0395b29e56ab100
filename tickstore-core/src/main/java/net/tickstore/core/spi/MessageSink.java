package net.tickstore.core.spi;

/** Outbound delivery channel. Failures are reported to the caller, who only logs them. */
@FunctionalInterface
public interface MessageSink {
    void send(long chatId, String text) throws Exception;
}

package net.tickstore.core.service;

import net.tickstore.core.spi.SchedulerEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Start/shutdown lifecycle around the external engine. Shutdown stops the engine and then runs
 * the shutdown callback; deliveries already in flight are left to finish on their own.
 */
public final class SchedulerRuntime {
    private static final Logger log = LoggerFactory.getLogger(SchedulerRuntime.class);

    private final SchedulerEngine engine;
    private final Runnable shutdownHandler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public SchedulerRuntime(SchedulerEngine engine) {
        this(engine, () -> log.info("Shut down done"));
    }

    public SchedulerRuntime(SchedulerEngine engine, Runnable shutdownHandler) {
        this.engine = engine;
        this.shutdownHandler = shutdownHandler;
    }

    public void start() throws Exception {
        if (!running.compareAndSet(false, true)) return;
        try {
            engine.start();
        } catch (Exception e) {
            running.set(false);
            log.error("Failed to start scheduler engine: {}", e.getMessage());
            throw e;
        }
        log.info("Scheduler engine started");
    }

    /** Safe to call more than once; only the first call after {@link #start()} has an effect. */
    public void shutdown() {
        if (!running.compareAndSet(true, false)) return;
        try {
            engine.shutdown();
        } catch (Exception e) {
            log.error("Scheduler engine shutdown failed: {}", e.getMessage(), e);
        } finally {
            shutdownHandler.run();
        }
    }

    public boolean isRunning() { return running.get(); }
}

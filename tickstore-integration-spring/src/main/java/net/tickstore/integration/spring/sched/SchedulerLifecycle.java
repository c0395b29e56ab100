package net.tickstore.integration.spring.sched;

import net.tickstore.core.service.SchedulerRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the scheduler engine once the context is refreshed and shuts it down when the context
 * closes (including on JVM shutdown signals, through Spring's shutdown hook).
 */
public class SchedulerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(SchedulerLifecycle.class);

    private final SchedulerRuntime runtime;
    private final boolean autoStart;

    public SchedulerLifecycle(SchedulerRuntime runtime, boolean autoStart) {
        this.runtime = runtime;
        this.autoStart = autoStart;
    }

    @Override
    public void start() {
        try {
            runtime.start();
        } catch (Exception e) {
            throw new IllegalStateException("Scheduler engine failed to start", e);
        }
    }

    @Override
    public void stop() {
        log.info("Shutting down scheduler engine");
        runtime.shutdown();
    }

    @Override
    public boolean isRunning() { return runtime.isRunning(); }

    @Override
    public boolean isAutoStartup() { return autoStart; }

    // stop before the data source goes away
    @Override
    public int getPhase() { return Integer.MAX_VALUE - 1000; }
}

package net.tickstore.core.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs one delivery task per recipient on a shared executor, waits for all of them and logs a
 * summary. A failing task is logged on its own and never cancels its siblings.
 */
public final class DeliveryFanOut {
    private static final Logger log = LoggerFactory.getLogger(DeliveryFanOut.class);

    private final ExecutorService executor;

    public DeliveryFanOut(ExecutorService executor) {
        this.executor = executor;
    }

    @FunctionalInterface
    public interface DeliveryTask<R> {
        void deliver(R recipient) throws Exception;
    }

    public <R> DeliveryReport deliver(String label, Collection<R> recipients, DeliveryTask<R> task)
            throws InterruptedException {
        List<Future<?>> futures = new ArrayList<>(recipients.size());
        List<R> order = new ArrayList<>(recipients);
        for (R r : order) {
            futures.add(executor.submit(() -> {
                task.deliver(r);
                return null;
            }));
        }

        int failed = 0;
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (ExecutionException e) {
                failed++;
                log.error("[{}] delivery to {} failed: {}", label, order.get(i), e.getCause().getMessage(), e.getCause());
            }
        }

        DeliveryReport report = new DeliveryReport(order.size(), order.size() - failed, failed);
        log.info("[{}] delivery finished: {}", label, report);
        return report;
    }

    public record DeliveryReport(int total, int delivered, int failed) {}
}

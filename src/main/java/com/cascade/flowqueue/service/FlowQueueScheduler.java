package com.cascade.flowqueue.service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import com.cascade.flowqueue.config.FlowQueueProperties;

/**
 * Drives the periodic maintenance of the flow queue. Each tick runs, in order:
 * expiration sweep, throughput sample, time-estimate recompute.
 */
@Slf4j
@Component
public class FlowQueueScheduler {

    private final ExpirationSweeper sweeper;
    private final ThroughputTracker throughputTracker;
    private final TimeEstimator timeEstimator;
    private final long tickIntervalMs;

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> tickFuture;

    public FlowQueueScheduler(ExpirationSweeper sweeper,
                              ThroughputTracker throughputTracker,
                              TimeEstimator timeEstimator,
                              FlowQueueProperties properties) {
        this.sweeper = sweeper;
        this.throughputTracker = throughputTracker;
        this.timeEstimator = timeEstimator;
        this.tickIntervalMs = properties.getTickInterval().toMillis();
    }

    @PostConstruct
    public synchronized void start() {
        if (isRunning()) {
            log.debug("Flow queue scheduler already running");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "flow-queue-maintenance");
            t.setDaemon(true);
            return t;
        });
        tickFuture = executor.scheduleAtFixedRate(this::tick, tickIntervalMs, tickIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Flow queue maintenance started (tick every {} ms)", tickIntervalMs);
    }

    @PreDestroy
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        tickFuture.cancel(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        executor = null;
        tickFuture = null;
        log.info("Flow queue maintenance stopped");
    }

    public synchronized boolean isRunning() {
        return executor != null && !executor.isShutdown();
    }

    /**
     * One maintenance pass. A failing step is logged and does not stop the ones after it.
     */
    public void tick() {
        try {
            sweeper.sweep();
        } catch (Exception e) {
            log.error("Expiration sweep failed: {}", e.getMessage(), e);
        }
        try {
            throughputTracker.sample();
        } catch (Exception e) {
            log.error("Throughput sampling failed: {}", e.getMessage(), e);
        }
        try {
            timeEstimator.recompute();
        } catch (Exception e) {
            log.error("Time estimate recompute failed: {}", e.getMessage(), e);
        }
    }
}

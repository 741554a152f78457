package com.cascade.flowqueue.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import com.cascade.flowqueue.config.FlowQueueProperties;

/**
 * Rolling throughput of completed flow deliveries, in items per minute.
 * Samples are taken opportunistically from the maintenance tick.
 */
@Slf4j
@Component
public class ThroughputTracker {

    private final Clock clock;
    private final Duration sampleInterval;
    private final int historySize;

    private final Deque<Double> history = new ArrayDeque<>();
    private long completionsSinceLastSample;
    private Instant lastSampleAt;

    public ThroughputTracker(FlowQueueProperties properties, Clock clock) {
        this.clock = clock;
        this.sampleInterval = properties.getTickInterval();
        this.historySize = Math.max(1, properties.getHistorySize());
        this.lastSampleAt = clock.instant();
    }

    public synchronized void recordCompletion() {
        completionsSinceLastSample++;
    }

    /**
     * Takes a sample if at least one sample interval has elapsed since the previous one.
     * @return true if a sample was recorded
     */
    public synchronized boolean sample() {
        Instant now = clock.instant();
        Duration elapsed = Duration.between(lastSampleAt, now);
        if (elapsed.compareTo(sampleInterval) < 0) {
            return false;
        }

        double elapsedMinutes = elapsed.toMillis() / 60_000.0;
        double itemsPerMinute = completionsSinceLastSample / elapsedMinutes;

        history.addLast(itemsPerMinute);
        while (history.size() > historySize) {
            history.removeFirst();
        }

        log.debug("Throughput sample: {} completions over {} min -> {} items/min (history size {})",
                completionsSinceLastSample, elapsedMinutes, itemsPerMinute, history.size());

        completionsSinceLastSample = 0;
        lastSampleAt = now;
        return true;
    }

    /**
     * Mean of the sample history rounded to one decimal place, 0 when no sample exists yet.
     */
    public synchronized double averageSpeed() {
        if (history.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (double speed : history) {
            sum += speed;
        }
        return Math.round((sum / history.size()) * 10) / 10.0;
    }

    public synchronized List<Double> getHistory() {
        return new ArrayList<>(history);
    }

    public synchronized long getPendingCompletions() {
        return completionsSinceLastSample;
    }
}

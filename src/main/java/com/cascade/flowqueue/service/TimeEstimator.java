package com.cascade.flowqueue.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import com.cascade.flowqueue.model.QueuedFlow;

/**
 * Recomputes seconds-remaining for every active delivery.
 * <p>
 * All active deliveries are modelled as sharing one outbound channel, regardless of instance:
 * each entry waits for every entry queued before it, then for its own remaining messages.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TimeEstimator {

    private final FlowQueueStore store;
    private final ThroughputTracker throughputTracker;

    /**
     * @return number of entries whose estimate was refreshed; 0 when no throughput is known yet
     */
    public int recompute() {
        double itemsPerMinute = throughputTracker.averageSpeed();
        if (itemsPerMinute <= 0) {
            log.debug("No throughput measured yet, keeping previous estimates");
            return 0;
        }
        int updated = store.applyEstimates(active -> estimate(active, itemsPerMinute));
        log.debug("Refreshed estimates for {} active flow(s) at {} items/min", updated, itemsPerMinute);
        return updated;
    }

    /**
     * Estimates for {@code activeFlows} in the given order. Empty when {@code itemsPerMinute <= 0}.
     */
    public static Map<String, Double> estimate(List<QueuedFlow> activeFlows, double itemsPerMinute) {
        Map<String, Double> estimates = new LinkedHashMap<>();
        if (itemsPerMinute <= 0) {
            return estimates;
        }
        double messagesPerSecond = itemsPerMinute / 60;

        double cumulativeSeconds = 0;
        for (QueuedFlow flow : activeFlows) {
            double ownSeconds = (flow.getTotalMessages() - flow.getMessageIndex()) / messagesPerSecond;
            estimates.put(flow.getId(), cumulativeSeconds + ownSeconds);
            cumulativeSeconds += ownSeconds;
        }
        return estimates;
    }
}

package com.cascade.flowqueue.service;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Exposes the queue projection as gauges.
 */
@Component
@RequiredArgsConstructor
public class FlowQueueMetrics {

    private final FlowQueueStore store;
    private final ThroughputTracker throughputTracker;
    private final MeterRegistry meterRegistry;

    @PostConstruct
    public void bind() {
        Gauge.builder("flowqueue.active", store, s -> s.snapshot().activeQueues())
                .description("Pending or sending flow deliveries")
                .register(meterRegistry);
        Gauge.builder("flowqueue.messages.queued", store, s -> s.snapshot().totalMessagesQueued())
                .description("Messages still to be sent across active deliveries")
                .register(meterRegistry);
        Gauge.builder("flowqueue.instances.in_use", store, s -> s.snapshot().instancesInUse())
                .register(meterRegistry);
        Gauge.builder("flowqueue.entries", store, FlowQueueStore::size)
                .register(meterRegistry);
        Gauge.builder("flowqueue.processing.speed", throughputTracker, ThroughputTracker::averageSpeed)
                .description("Average completed deliveries per minute")
                .baseUnit("items/min")
                .register(meterRegistry);
    }
}

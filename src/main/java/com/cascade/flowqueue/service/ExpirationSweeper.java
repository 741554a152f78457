package com.cascade.flowqueue.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import com.cascade.flowqueue.config.FlowQueueProperties;

/**
 * Drops sent/failed deliveries once they have been idle longer than the retention window.
 * Active deliveries are never swept.
 */
@Slf4j
@Component
public class ExpirationSweeper {

    private final FlowQueueStore store;
    private final Clock clock;
    private final Duration retention;

    public ExpirationSweeper(FlowQueueStore store, FlowQueueProperties properties, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.retention = properties.getRetention();
    }

    /**
     * @return ids of the expired entries
     */
    public List<String> sweep() {
        Instant cutoff = clock.instant().minus(retention);
        List<String> expired = store.expireTerminalBefore(cutoff);
        if (!expired.isEmpty()) {
            log.info("Expired {} finished flow(s) older than {} min", expired.size(), retention.toMinutes());
        }
        return expired;
    }
}

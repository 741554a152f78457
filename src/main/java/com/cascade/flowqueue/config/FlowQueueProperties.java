package com.cascade.flowqueue.config;

import java.time.Duration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "flow-queue")
public class FlowQueueProperties {

    /** Interval of the maintenance tick (sweep, throughput sample, estimate recompute). */
    private Duration tickInterval = Duration.ofSeconds(60);

    /** How long a sent/failed entry stays visible before the sweeper drops it. */
    private Duration retention = Duration.ofHours(1);

    /** Number of throughput samples kept for the rolling average. */
    private int historySize = 10;

    private Stream stream = new Stream();

    @Data
    public static class Stream {
        private Duration emitterTimeout = Duration.ofMinutes(30);
    }
}

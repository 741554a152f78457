package com.cascade.flowqueue.model;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Data supplied by the dispatch worker when it starts (or restarts) a delivery.
 * Null fields are left untouched when merged into an existing entry.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FlowAdmission {
    private String flowId;
    private String flowName;
    private String instanceId;
    private String instanceName;
    private String recipientNumber;
    private String recipientName;
    private FlowStatus status;
    private Instant scheduledTime;
    private Integer messageIndex;
    private Integer totalMessages;
    private String triggerKeyword;
    private String triggerMessage;
}

package com.cascade.flowqueue.model;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One tracked delivery of a flow's message sequence to one recipient.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueuedFlow {
    private String id;
    private String flowId;
    private String flowName;
    private String instanceId;
    private String instanceName;
    private String recipientNumber;
    private String recipientName;
    private FlowStatus status;
    private Instant scheduledTime;
    private int messageIndex;
    private int totalMessages;
    private Instant createdAt;
    private Instant lastUpdated;
    private Double estimatedTimeRemaining; // seconds, null until first estimate
    private String triggerKeyword;
    private String triggerMessage;

    @JsonIgnore
    public boolean isActive() {
        return status != null && status.isActive();
    }

    @JsonIgnore
    public int getRemainingMessages() {
        return Math.max(0, totalMessages - messageIndex);
    }

    public QueuedFlow copy() {
        return toBuilder().build();
    }
}

package com.cascade.flowqueue.api;

import java.time.Instant;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import com.cascade.flowqueue.model.FlowAdmission;
import com.cascade.flowqueue.model.FlowStatus;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FlowAdmissionRequest {

    @NotBlank
    private String flowId;

    private String flowName;

    private String instanceId;

    private String instanceName;

    @NotBlank
    private String recipientNumber;

    private String recipientName;

    @Pattern(regexp = "(?i)pending|sending|sent|failed", message = "status must be pending, sending, sent or failed")
    private String status;

    private Instant scheduledTime;

    @PositiveOrZero
    private Integer messageIndex;

    @PositiveOrZero
    private Integer totalMessages;

    private String triggerKeyword;

    private String triggerMessage;

    public FlowAdmission toAdmission() {
        return FlowAdmission.builder()
                .flowId(flowId)
                .flowName(flowName)
                .instanceId(instanceId)
                .instanceName(instanceName)
                .recipientNumber(recipientNumber)
                .recipientName(recipientName)
                .status(status != null ? FlowStatus.fromWireName(status) : null)
                .scheduledTime(scheduledTime)
                .messageIndex(messageIndex)
                .totalMessages(totalMessages)
                .triggerKeyword(triggerKeyword)
                .triggerMessage(triggerMessage)
                .build();
    }
}

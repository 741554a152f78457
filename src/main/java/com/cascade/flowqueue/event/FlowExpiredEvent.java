package com.cascade.flowqueue.event;

import java.util.Map;

/**
 * Emitted when the sweeper drops a terminal entry past its retention window.
 */
public class FlowExpiredEvent extends FlowQueueEvent {

    public FlowExpiredEvent(Object source, String queuedFlowId) {
        super(source, FlowQueueEventType.FLOW_EXPIRED, queuedFlowId);
    }

    @Override
    public Object getPayload() {
        return Map.of("id", getQueuedFlowId());
    }
}

package com.cascade.flowqueue.event;

import java.util.Map;

/**
 * Emitted when a delivery is removed explicitly.
 */
public class FlowRemovedEvent extends FlowQueueEvent {

    public FlowRemovedEvent(Object source, String queuedFlowId) {
        super(source, FlowQueueEventType.FLOW_REMOVED, queuedFlowId);
    }

    @Override
    public Object getPayload() {
        return Map.of("id", getQueuedFlowId());
    }
}

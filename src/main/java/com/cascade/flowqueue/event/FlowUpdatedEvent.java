package com.cascade.flowqueue.event;

import com.cascade.flowqueue.model.QueuedFlow;

import lombok.Getter;

/**
 * Emitted when an admission merges into a delivery or its status changes.
 */
@Getter
public class FlowUpdatedEvent extends FlowQueueEvent {

    private final QueuedFlow flow;

    public FlowUpdatedEvent(Object source, QueuedFlow flow) {
        super(source, FlowQueueEventType.FLOW_UPDATED, flow.getId());
        this.flow = flow;
    }

    @Override
    public Object getPayload() {
        return flow;
    }
}

package com.cascade.flowqueue.event;

import com.cascade.flowqueue.model.QueuedFlow;

import lombok.Getter;

/**
 * Emitted when a delivery is first admitted to the queue.
 */
@Getter
public class FlowAddedEvent extends FlowQueueEvent {

    private final QueuedFlow flow;

    public FlowAddedEvent(Object source, QueuedFlow flow) {
        super(source, FlowQueueEventType.FLOW_ADDED, flow.getId());
        this.flow = flow;
    }

    @Override
    public Object getPayload() {
        return flow;
    }
}

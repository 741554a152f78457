package com.cascade.flowqueue.event;

import org.springframework.context.ApplicationEvent;

import lombok.Getter;

/**
 * Base type of every queue state change. The set of subclasses is closed:
 * {@link FlowAddedEvent}, {@link FlowUpdatedEvent}, {@link FlowRemovedEvent}, {@link FlowExpiredEvent}.
 */
@Getter
public abstract class FlowQueueEvent extends ApplicationEvent {

    private final FlowQueueEventType type;
    private final String queuedFlowId;

    FlowQueueEvent(Object source, FlowQueueEventType type, String queuedFlowId) {
        super(source);
        this.type = type;
        this.queuedFlowId = queuedFlowId;
    }

    /**
     * Payload pushed to observers: the entry for add/update, the identifier otherwise.
     */
    public abstract Object getPayload();
}

package com.cascade.flowqueue.event;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import com.cascade.flowqueue.model.QueuedFlow;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Typed front for publishing queue events. Listeners subscribe with
 * {@code @EventListener} on {@link FlowQueueEvent} or one of its subclasses and receive
 * events synchronously, in emission order. A failing listener is logged and never reaches
 * the caller whose change triggered the event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlowQueueEventNotifier {

    private final ApplicationEventPublisher eventPublisher;

    public void flowAdded(QueuedFlow flow) {
        publish(new FlowAddedEvent(this, flow));
    }

    public void flowUpdated(QueuedFlow flow) {
        publish(new FlowUpdatedEvent(this, flow));
    }

    public void flowRemoved(String queuedFlowId) {
        publish(new FlowRemovedEvent(this, queuedFlowId));
    }

    public void flowExpired(String queuedFlowId) {
        publish(new FlowExpiredEvent(this, queuedFlowId));
    }

    private void publish(FlowQueueEvent event) {
        log.debug("Publishing {} for {}", event.getType().getEventName(), event.getQueuedFlowId());
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("Listener failed handling {} for {}: {}", event.getType().getEventName(),
                    event.getQueuedFlowId(), e.getMessage(), e);
        }
    }
}

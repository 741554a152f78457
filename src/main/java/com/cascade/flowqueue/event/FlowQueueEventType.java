package com.cascade.flowqueue.event;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FlowQueueEventType {
    FLOW_ADDED("flow-added"),
    FLOW_UPDATED("flow-updated"),
    FLOW_REMOVED("flow-removed"),
    FLOW_EXPIRED("flow-expired");

    private final String eventName;

    FlowQueueEventType(String eventName) {
        this.eventName = eventName;
    }

    @JsonValue
    public String getEventName() {
        return eventName;
    }
}

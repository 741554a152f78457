package com.cascade.flowqueue.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Delivery status of a queued flow. PENDING and SENDING are active, SENT and FAILED are terminal.
 */
public enum FlowStatus {
    PENDING, SENDING, SENT, FAILED;

    public boolean isActive() {
        return this == PENDING || this == SENDING;
    }

    public boolean isTerminal() {
        return !isActive();
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the lowercase wire name (case-insensitive).
     * @throws IllegalArgumentException for an unknown value
     */
    @JsonCreator
    public static FlowStatus fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status must not be blank");
        }
        try {
            return FlowStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown flow status: " + value);
        }
    }
}

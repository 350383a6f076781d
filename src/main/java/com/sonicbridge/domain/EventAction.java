package com.sonicbridge.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Disposition the appliance applied to a connection.
 * Only {@link #ALLOW} means traffic was permitted.
 */
public enum EventAction {

    ALLOW("allow"),

    DENY("deny"),

    DROP("drop"),

    RESET("reset");

    private final String value;

    EventAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Deny and drop stop the traffic; a reset is counted with the permitted flows.
     */
    public boolean isBlocking() {
        return this == DENY || this == DROP;
    }

    /**
     * Parse a string value to EventAction
     */
    public static EventAction fromValue(String value) {
        for (EventAction action : EventAction.values()) {
            if (action.value.equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown EventAction value: " + value);
    }
}

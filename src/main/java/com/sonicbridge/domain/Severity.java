package com.sonicbridge.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a normalized firewall event.
 */
public enum Severity {

    /**
     * Emergency and alert level events
     */
    CRITICAL("critical"),

    /**
     * Critical and error level events
     */
    HIGH("high"),

    /**
     * Warning level events
     */
    MEDIUM("medium"),

    /**
     * Notice level events
     */
    LOW("low"),

    /**
     * Informational and debug events
     */
    INFO("info");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

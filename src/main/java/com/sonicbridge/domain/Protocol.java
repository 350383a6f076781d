package com.sonicbridge.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Transport protocol of a connection.
 */
public enum Protocol {

    TCP("TCP"),

    UDP("UDP"),

    ICMP("ICMP"),

    OTHER("OTHER");

    private final String value;

    Protocol(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

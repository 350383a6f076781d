package com.sonicbridge.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed classification of threat detections.
 */
public enum ThreatType {

    MALWARE("malware"),

    INTRUSION("intrusion"),

    BOTNET("botnet"),

    SPAM("spam"),

    SUSPICIOUS("suspicious");

    private final String value;

    ThreatType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

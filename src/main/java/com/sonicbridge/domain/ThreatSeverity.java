package com.sonicbridge.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a threat detection. Narrower than {@link Severity}: there is no info level.
 */
public enum ThreatSeverity {

    CRITICAL("critical", 4),

    HIGH("high", 3),

    MEDIUM("medium", 2),

    LOW("low", 1);

    private final String value;
    private final int rank;

    ThreatSeverity(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getRank() {
        return rank;
    }
}

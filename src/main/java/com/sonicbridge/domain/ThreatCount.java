package com.sonicbridge.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Detection count for a threat type.
 */
public final class ThreatCount {

    @JsonProperty("type")
    private final String type;

    @JsonProperty("count")
    private final long count;

    public ThreatCount(String type, long count) {
        this.type = type;
        this.count = count;
    }

    public String getType() {
        return type;
    }

    public long getCount() {
        return count;
    }
}

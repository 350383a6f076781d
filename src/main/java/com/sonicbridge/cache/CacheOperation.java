package com.sonicbridge.cache;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Retrieval operations whose results are cached. Each has its own default lifetime.
 */
public enum CacheOperation {

    LOGS("logs"),

    THREATS("threats"),

    STATS("stats");

    private final String value;

    CacheOperation(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

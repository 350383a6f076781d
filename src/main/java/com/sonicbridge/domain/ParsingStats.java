package com.sonicbridge.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Summary of a normalization run: how many units matched a dialect pattern
 * and how many needed the fallback extractor.
 */
public final class ParsingStats {

    @JsonProperty("total")
    private final int total;

    @JsonProperty("parsed")
    private final int parsed;

    @JsonProperty("fallback")
    private final int fallback;

    @JsonProperty("by_category")
    private final Map<EventCategory, Long> byCategory;

    @JsonProperty("by_action")
    private final Map<EventAction, Long> byAction;

    @JsonProperty("by_parser")
    private final Map<String, Long> byParser;

    public ParsingStats(int total, int parsed, int fallback, Map<EventCategory, Long> byCategory,
                        Map<EventAction, Long> byAction, Map<String, Long> byParser) {
        this.total = total;
        this.parsed = parsed;
        this.fallback = fallback;
        this.byCategory = Map.copyOf(byCategory);
        this.byAction = Map.copyOf(byAction);
        this.byParser = Map.copyOf(byParser);
    }

    public int getTotal() {
        return total;
    }

    public int getParsed() {
        return parsed;
    }

    public int getFallback() {
        return fallback;
    }

    public Map<EventCategory, Long> getByCategory() {
        return byCategory;
    }

    public Map<EventAction, Long> getByAction() {
        return byAction;
    }

    public Map<String, Long> getByParser() {
        return byParser;
    }
}

package com.sonicbridge.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time view of the result cache counters.
 */
public final class CacheSnapshot {

    @JsonProperty("entries")
    private final long entries;

    @JsonProperty("hits")
    private final long hits;

    @JsonProperty("misses")
    private final long misses;

    @JsonProperty("evictions")
    private final long evictions;

    public CacheSnapshot(long entries, long hits, long misses, long evictions) {
        this.entries = entries;
        this.hits = hits;
        this.misses = misses;
        this.evictions = evictions;
    }

    public long getEntries() {
        return entries;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public long getEvictions() {
        return evictions;
    }

    @JsonProperty("hit_rate")
    public double getHitRate() {
        long requests = hits + misses;
        return requests == 0 ? 0.0 : (double) hits / requests;
    }
}

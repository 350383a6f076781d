package com.sonicbridge.retrieval;

import java.time.Duration;
import java.util.Optional;

/**
 * Timeouts, rate-limit waits and result caps applied to every appliance call.
 */
public final class RetrievalPolicy {

    private final Duration requestTimeout;
    private final Duration defaultRateLimitWait;
    private final Duration maxRateLimitWait;
    private final int maxRecords;

    public RetrievalPolicy(Duration requestTimeout, Duration defaultRateLimitWait, Duration maxRateLimitWait,
                           int maxRecords) {
        if (maxRecords <= 0) {
            throw new IllegalArgumentException("maxRecords must be positive: " + maxRecords);
        }
        this.requestTimeout = requestTimeout;
        this.defaultRateLimitWait = defaultRateLimitWait;
        this.maxRateLimitWait = maxRateLimitWait;
        this.maxRecords = maxRecords;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    /**
     * Wait before retrying a rate-limited request: the requested wait, or the default,
     * never longer than the configured ceiling.
     */
    public Duration rateLimitWait(Optional<Duration> requested) {
        Duration wait = requested.orElse(defaultRateLimitWait);
        return wait.compareTo(maxRateLimitWait) > 0 ? maxRateLimitWait : wait;
    }

    /**
     * Requested result count capped at the hard ceiling
     */
    public int cap(int requested) {
        return Math.min(requested, maxRecords);
    }

    public int getMaxRecords() {
        return maxRecords;
    }
}

package com.sonicbridge.appliance;

import java.time.Duration;

/**
 * Exception thrown when the appliance keeps rate limiting after the single permitted retry
 */
public class RateLimitedException extends RetrievalException {

    private final Duration waited;

    public RateLimitedException(ApiEndpoint endpoint, Duration waited) {
        super("Rate limit persisted after waiting " + waited.toMillis() + "ms", endpoint);
        this.waited = waited;
    }

    public Duration getWaited() {
        return waited;
    }
}

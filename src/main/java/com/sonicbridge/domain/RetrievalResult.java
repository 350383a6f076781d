package com.sonicbridge.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Wraps data returned to the tool layer together with its provenance.
 *
 * A placeholder result carries synthetic data produced while the appliance was
 * unreachable; callers should present it as "appliance temporarily unavailable".
 *
 * @param <T> the payload type
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RetrievalResult<T> {

    @JsonProperty("data")
    private final T data;

    @JsonProperty("placeholder")
    private final boolean placeholder;

    @JsonProperty("failure_reason")
    private final String failureReason;

    @JsonProperty("retrieved_at")
    private final Instant retrievedAt;

    private RetrievalResult(T data, boolean placeholder, String failureReason, Instant retrievedAt) {
        this.data = Objects.requireNonNull(data, "data");
        this.placeholder = placeholder;
        this.failureReason = failureReason;
        this.retrievedAt = retrievedAt;
    }

    /**
     * Result backed by real appliance data
     */
    public static <T> RetrievalResult<T> live(T data, Instant retrievedAt) {
        return new RetrievalResult<>(data, false, null, retrievedAt);
    }

    /**
     * Synthetic result standing in for appliance data
     */
    public static <T> RetrievalResult<T> placeholder(T data, String failureReason, Instant retrievedAt) {
        return new RetrievalResult<>(data, true, failureReason, retrievedAt);
    }

    public T getData() {
        return data;
    }

    public boolean isPlaceholder() {
        return placeholder;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public Instant getRetrievedAt() {
        return retrievedAt;
    }
}

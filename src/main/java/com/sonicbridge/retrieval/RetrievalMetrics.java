package com.sonicbridge.retrieval;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metrics collector for appliance retrieval.
 *
 * Tracks per-operation calls, upstream errors, placeholder results and latency,
 * plus re-authentications and rate-limit waits across all operations.
 */
public class RetrievalMetrics {

    private final MeterRegistry registry;
    private final Map<String, Counter> calls = new ConcurrentHashMap<>();
    private final Map<String, Counter> errors = new ConcurrentHashMap<>();
    private final Map<String, Counter> placeholders = new ConcurrentHashMap<>();
    private final Map<String, Timer> latency = new ConcurrentHashMap<>();
    private final Counter reauthentications;
    private final Counter rateLimited;

    public RetrievalMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.reauthentications = Counter.builder("sonicbridge.retrieval.reauthentications")
            .description("Number of times a rejected session was replaced mid-request")
            .register(registry);
        this.rateLimited = Counter.builder("sonicbridge.retrieval.rate_limited")
            .description("Number of 429 responses that triggered a wait")
            .register(registry);
    }

    public void recordCall(String operation) {
        counter(calls, "sonicbridge.retrieval.calls", "Retrieval operations started", operation).increment();
    }

    public void recordError(String operation) {
        counter(errors, "sonicbridge.retrieval.errors", "Retrieval operations that failed upstream", operation)
            .increment();
    }

    public void recordPlaceholder(String operation) {
        counter(placeholders, "sonicbridge.retrieval.placeholders", "Placeholder results returned", operation)
            .increment();
    }

    public void recordReauthentication() {
        reauthentications.increment();
    }

    public void recordRateLimited() {
        rateLimited.increment();
    }

    /**
     * Records the latency of the given publisher under the operation tag
     */
    public <T> Mono<T> time(String operation, Mono<T> mono) {
        Timer timer = latency.computeIfAbsent(operation, op ->
            Timer.builder("sonicbridge.retrieval.latency")
                .tag("operation", op)
                .description("Latency of appliance retrieval")
                .register(registry));
        return Mono.defer(() -> {
            Timer.Sample sample = Timer.start(registry);
            return mono.doFinally(signal -> sample.stop(timer));
        });
    }

    private Counter counter(Map<String, Counter> counters, String name, String description, String operation) {
        return counters.computeIfAbsent(operation, op ->
            Counter.builder(name)
                .tag("operation", op)
                .description(description)
                .register(registry));
    }
}

package com.sonicbridge.appliance;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * {@link ApplianceTransport} backed by Spring's reactive {@link WebClient}.
 *
 * Every HTTP status is surfaced as an {@link ApplianceResponse} so the retrieval
 * policy can decide on 401/429 handling. Connection-level failures trip the circuit
 * breaker; while it is open calls fail fast with {@link ApplianceUnavailableException}.
 */
public class WebClientApplianceTransport implements ApplianceTransport {

    private static final Logger log = LoggerFactory.getLogger(WebClientApplianceTransport.class);

    private final WebClient webClient;
    private final CircuitBreaker circuitBreaker;

    public WebClientApplianceTransport(WebClient webClient, CircuitBreaker circuitBreaker) {
        this.webClient = webClient;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public Mono<ApplianceResponse> exchange(ApplianceRequest request) {
        WebClient.RequestBodySpec spec = webClient.method(request.getMethod())
            .uri(builder -> {
                builder.path(request.getPath());
                request.getQueryParams().forEach(builder::queryParam);
                return builder.build();
            });
        request.getHeaders().forEach(spec::header);

        WebClient.RequestHeadersSpec<?> ready = request.getBody() != null
            ? spec.bodyValue(request.getBody())
            : spec;

        return ready.exchangeToMono(response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new ApplianceResponse(
                    response.statusCode().value(),
                    response.headers().asHttpHeaders().toSingleValueMap(),
                    body)))
            .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
            .doOnNext(response -> log.debug("{} -> {}", request, response.getStatus()))
            .onErrorMap(e -> !(e instanceof RetrievalException), e -> toUnavailable(request, e));
    }

    private ApplianceUnavailableException toUnavailable(ApplianceRequest request, Throwable e) {
        if (e instanceof CallNotPermittedException) {
            log.warn("Circuit breaker open, skipping {}", request);
            return new ApplianceUnavailableException("Circuit breaker open", request.getEndpoint(), e);
        }
        log.warn("Request {} failed: {}", request, e.getMessage());
        return new ApplianceUnavailableException("Appliance unreachable: " + e.getMessage(),
            request.getEndpoint(), e);
    }
}

package com.sonicbridge.appliance;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WebClientApplianceTransport Tests")
class WebClientApplianceTransportTest {

    private final AtomicReference<ClientRequest> sent = new AtomicReference<>();
    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        circuitBreaker = CircuitBreaker.ofDefaults("appliance-test");
    }

    private WebClientApplianceTransport transport(Mono<ClientResponse> reply) {
        WebClient webClient = WebClient.builder()
            .baseUrl("https://fw.example.com")
            .exchangeFunction(request -> {
                sent.set(request);
                return reply;
            })
            .build();
        return new WebClientApplianceTransport(webClient, circuitBreaker);
    }

    @Test
    void testExchange_ShouldSendPathQueryAndHeaders() {
        // Given
        WebClientApplianceTransport transport = transport(Mono.just(
            ClientResponse.create(HttpStatus.OK)
                .header("Content-Type", "application/json")
                .body("{\"logs\":[]}")
                .build()));
        Map<String, String> query = new LinkedHashMap<>();
        query.put("count", "100");
        query.put("category", "ips");
        ApplianceRequest request = ApplianceRequest.get(DialectVersion.V7, ApiEndpoint.LOGS, query)
            .withHeader("Authorization", "Bearer abc");

        // When / Then
        StepVerifier.create(transport.exchange(request))
            .assertNext(response -> {
                assertThat(response.getStatus()).isEqualTo(200);
                assertThat(response.getBody()).isEqualTo("{\"logs\":[]}");
                assertThat(response.isSuccessful()).isTrue();
            })
            .verifyComplete();

        ClientRequest clientRequest = sent.get();
        assertThat(clientRequest.method()).isEqualTo(HttpMethod.GET);
        assertThat(clientRequest.url().toString())
            .isEqualTo("https://fw.example.com/api/sonicos/reporting/log?count=100&category=ips");
        assertThat(clientRequest.headers().getFirst("Authorization")).isEqualTo("Bearer abc");
        assertThat(clientRequest.headers().getFirst("X-API-Version")).isEqualTo("v1");
        assertThat(clientRequest.headers().getFirst("X-Request-Type")).isEqualTo("log-query");
    }

    @Test
    void testExchange_WithErrorStatus_ShouldReturnResponseNotError() {
        WebClientApplianceTransport transport = transport(Mono.just(
            ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS).header("Retry-After", "7").build()));

        StepVerifier.create(transport.exchange(ApplianceRequest.get(DialectVersion.V8, ApiEndpoint.THREATS)))
            .assertNext(response -> {
                assertThat(response.isRateLimited()).isTrue();
                assertThat(response.getBody()).isEmpty();
                assertThat(response.retryAfter()).contains(Duration.ofSeconds(7));
            })
            .verifyComplete();
        assertThat(sent.get().url().getPath()).isEqualTo("/api/sonicos/v8/reporting/security-services");
    }

    @Test
    void testExchange_WhenConnectionFails_ShouldMapToUnavailable() {
        WebClientApplianceTransport transport = transport(Mono.error(new ConnectException("Connection refused")));

        StepVerifier.create(transport.exchange(ApplianceRequest.get(DialectVersion.V7, ApiEndpoint.DASHBOARD)))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(ApplianceUnavailableException.class);
                assertThat(((RetrievalException) error).getEndpoint()).isEqualTo(ApiEndpoint.DASHBOARD);
                assertThat(error).hasRootCauseInstanceOf(ConnectException.class);
            })
            .verify();
    }

    @Test
    void testExchange_WhenCircuitOpen_ShouldFailWithoutSending() {
        WebClientApplianceTransport transport = transport(Mono.just(ClientResponse.create(HttpStatus.OK).build()));
        circuitBreaker.transitionToOpenState();

        StepVerifier.create(transport.exchange(ApplianceRequest.get(DialectVersion.V7, ApiEndpoint.STATISTICS)))
            .expectErrorSatisfies(error -> assertThat(error)
                .isInstanceOf(ApplianceUnavailableException.class)
                .hasMessageContaining("Circuit breaker open"))
            .verify();
        assertThat(sent.get()).isNull();
    }
}

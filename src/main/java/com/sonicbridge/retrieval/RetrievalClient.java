package com.sonicbridge.retrieval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sonicbridge.appliance.ApiEndpoint;
import com.sonicbridge.appliance.ApplianceRequest;
import com.sonicbridge.appliance.ApplianceResponse;
import com.sonicbridge.appliance.ApplianceTransport;
import com.sonicbridge.appliance.ApplianceUnavailableException;
import com.sonicbridge.appliance.DialectVersion;
import com.sonicbridge.appliance.MalformedResponseException;
import com.sonicbridge.appliance.RateLimitedException;
import com.sonicbridge.appliance.RetrievalException;
import com.sonicbridge.domain.CanonicalEvent;
import com.sonicbridge.domain.ConnectivityResult;
import com.sonicbridge.domain.EventFilter;
import com.sonicbridge.domain.RetrievalResult;
import com.sonicbridge.domain.SystemStats;
import com.sonicbridge.domain.ThreatRecord;
import com.sonicbridge.normalization.NormalizationService;
import com.sonicbridge.session.AuthenticationException;
import com.sonicbridge.session.Session;
import com.sonicbridge.session.SessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Client for the appliance's reporting endpoints.
 *
 * Every call goes through the same policy: obtain a session, send with a timeout,
 * on 401 replace the session once and retry, on 429 wait once and retry, and treat
 * any other non-2xx status as the appliance being unavailable. Upstream failures
 * degrade to labeled placeholder results; only {@link AuthenticationException}
 * reaches the caller.
 */
public class RetrievalClient {

    private static final Logger log = LoggerFactory.getLogger(RetrievalClient.class);

    private static final Duration STATS_FALLBACK_WINDOW = Duration.ofHours(24);

    private final ApplianceTransport transport;
    private final SessionManager sessionManager;
    private final NormalizationService normalizationService;
    private final ThreatResponseMapper threatMapper;
    private final StatsResponseMapper statsMapper;
    private final PlaceholderResults placeholders;
    private final RetrievalMetrics metrics;
    private final RetrievalPolicy policy;
    private final Clock clock;
    private final DialectVersion dialect;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public RetrievalClient(ApplianceTransport transport, SessionManager sessionManager,
                           NormalizationService normalizationService, ThreatResponseMapper threatMapper,
                           StatsResponseMapper statsMapper, PlaceholderResults placeholders,
                           RetrievalMetrics metrics, RetrievalPolicy policy, Clock clock) {
        this.transport = transport;
        this.sessionManager = sessionManager;
        this.normalizationService = normalizationService;
        this.threatMapper = threatMapper;
        this.statsMapper = statsMapper;
        this.placeholders = placeholders;
        this.metrics = metrics;
        this.policy = policy;
        this.clock = clock;
        this.dialect = sessionManager.getDialect();
    }

    /**
     * Fetch, normalize and filter log events
     *
     * @param filter validated synchronously; an invalid filter throws before any request is sent
     * @return live events newest first, or placeholder events if the appliance is unavailable
     */
    public Mono<RetrievalResult<List<CanonicalEvent>>> fetchEvents(EventFilter filter) {
        filter.validate();
        return Mono.defer(() -> {
            metrics.recordCall("logs");
            ApplianceRequest request = ApplianceRequest.get(dialect, ApiEndpoint.LOGS, logQuery(filter));
            return metrics.time("logs", execute(request))
                .map(response -> normalize(readJson(response, ApiEndpoint.LOGS)))
                .map(events -> RetrievalResult.live(applyFilter(events, filter), clock.instant()))
                .onErrorResume(RetrievalException.class,
                    e -> Mono.just(placeholder("logs", e, placeholders.events())));
        });
    }

    /**
     * Fetch current threat detections, most severe and newest first
     */
    public Mono<RetrievalResult<List<ThreatRecord>>> fetchThreats() {
        return Mono.defer(() -> {
            metrics.recordCall("threats");
            return metrics.time("threats", execute(ApplianceRequest.get(dialect, ApiEndpoint.THREATS)))
                .map(response -> threatMapper.map(readJson(response, ApiEndpoint.THREATS)))
                .map(threats -> RetrievalResult.live(threats, clock.instant()))
                .onErrorResume(RetrievalException.class,
                    e -> Mono.just(placeholder("threats", e, placeholders.threats())));
        });
    }

    /**
     * Fetch aggregate statistics from the dashboard, then the statistics endpoint, and
     * finally derive them from the last 24 hours of events.
     */
    public Mono<RetrievalResult<SystemStats>> fetchStats() {
        return Mono.defer(() -> {
            metrics.recordCall("stats");
            return metrics.time("stats", fetchStatsFrom(ApiEndpoint.DASHBOARD)
                    .onErrorResume(RetrievalException.class, e -> {
                        log.warn("Dashboard statistics unavailable, trying statistics endpoint: {}", e.getMessage());
                        return fetchStatsFrom(ApiEndpoint.STATISTICS);
                    }))
                .map(stats -> RetrievalResult.live(stats, clock.instant()))
                .onErrorResume(RetrievalException.class, e -> {
                    metrics.recordError("stats");
                    log.warn("Statistics endpoints unavailable, deriving from recent events: {}", e.getMessage());
                    return deriveStatsFromEvents();
                });
        });
    }

    /**
     * Fetch the appliance's system information document
     *
     * @return the document, or empty when the appliance is unavailable
     */
    public Mono<JsonNode> fetchSystemInfo() {
        return Mono.defer(() -> {
            metrics.recordCall("system-info");
            return metrics.time("system-info", execute(ApplianceRequest.get(dialect, ApiEndpoint.SYSTEM_INFO)))
                .map(response -> readJson(response, ApiEndpoint.SYSTEM_INFO))
                .onErrorResume(RetrievalException.class, e -> {
                    metrics.recordError("system-info");
                    log.warn("System information unavailable: {}", e.getMessage());
                    return Mono.empty();
                });
        });
    }

    /**
     * Authenticate and read the firmware version. Never errors; failures are reported in the result.
     */
    public Mono<ConnectivityResult> testConnectivity() {
        return sessionManager.authenticate()
            .then(fetchSystemInfo()
                .mapNotNull(info -> info.path("firmware_version").asText(null))
                .defaultIfEmpty("SonicOS " + dialect.getValue() + ".x"))
            .map(ConnectivityResult::connected)
            .onErrorResume(e -> {
                log.warn("Connectivity test failed: {}", e.getMessage());
                return Mono.just(ConnectivityResult.failed(e.getMessage()));
            });
    }

    /**
     * Query parameters for a log request in this dialect's naming
     */
    Map<String, String> logQuery(EventFilter filter) {
        DialectVersion.LogQueryNames names = dialect.getLogQueryNames();
        Map<String, String> query = new LinkedHashMap<>();
        if (filter.getStartTime() != null) {
            query.put(names.getStartTime(), filter.getStartTime().toString());
        }
        if (filter.getEndTime() != null) {
            query.put(names.getEndTime(), filter.getEndTime().toString());
        }
        if (filter.getCategory() != null) {
            query.put(names.getCategory(), filter.getCategory().getValue());
        }
        query.put(names.getLimit(), String.valueOf(policy.cap(filter.getLimit())));
        if (filter.getOffset() > 0) {
            query.put(names.getOffset(), String.valueOf(filter.getOffset()));
        }
        query.putAll(dialect.getFixedLogParameters());
        return query;
    }

    private Mono<SystemStats> fetchStatsFrom(ApiEndpoint endpoint) {
        return execute(ApplianceRequest.get(dialect, endpoint))
            .map(response -> statsMapper.map(readJson(response, endpoint), endpoint));
    }

    private Mono<RetrievalResult<SystemStats>> deriveStatsFromEvents() {
        Instant now = clock.instant();
        EventFilter window = EventFilter.builder()
            .startTime(now.minus(STATS_FALLBACK_WINDOW))
            .endTime(now)
            .limit(policy.getMaxRecords())
            .build();
        return fetchEvents(window).map(result -> {
            SystemStats stats = statsMapper.derive(result.getData());
            return result.isPlaceholder()
                ? RetrievalResult.placeholder(stats, result.getFailureReason(), result.getRetrievedAt())
                : RetrievalResult.live(stats, result.getRetrievedAt());
        });
    }

    private Mono<ApplianceResponse> execute(ApplianceRequest request) {
        return sendAuthorized(request)
            .flatMap(response -> response.isRateLimited()
                ? retryAfterRateLimit(request, response)
                : Mono.just(response))
            .flatMap(response -> requireSuccess(request, response));
    }

    private Mono<ApplianceResponse> sendAuthorized(ApplianceRequest request) {
        return sessionManager.currentSession()
            .flatMap(session -> send(request, session)
                .flatMap(response -> response.isUnauthorized()
                    ? reauthenticateAndRetry(request, session)
                    : Mono.just(response)));
    }

    private Mono<ApplianceResponse> reauthenticateAndRetry(ApplianceRequest request, Session rejected) {
        metrics.recordReauthentication();
        log.warn("Session rejected on {}, re-authenticating once", request);
        sessionManager.invalidate(rejected);
        return sessionManager.currentSession()
            .flatMap(fresh -> send(request, fresh))
            .flatMap(response -> response.isUnauthorized()
                ? Mono.error(new AuthenticationException(
                    "Appliance rejected a freshly issued session", response.getStatus()))
                : Mono.just(response));
    }

    private Mono<ApplianceResponse> retryAfterRateLimit(ApplianceRequest request, ApplianceResponse limited) {
        Duration wait = policy.rateLimitWait(limited.retryAfter());
        metrics.recordRateLimited();
        log.warn("Rate limited on {}, retrying in {}ms", request, wait.toMillis());
        return Mono.delay(wait)
            .then(sendAuthorized(request))
            .flatMap(response -> response.isRateLimited()
                ? Mono.error(new RateLimitedException(request.getEndpoint(), wait))
                : Mono.just(response));
    }

    private Mono<ApplianceResponse> send(ApplianceRequest request, Session session) {
        Duration timeout = policy.getRequestTimeout();
        return transport.exchange(sessionManager.authorize(request, session))
            .timeout(timeout)
            .onErrorMap(TimeoutException.class, e -> new ApplianceUnavailableException(
                "Request timed out after " + timeout.toMillis() + "ms", request.getEndpoint(), e));
    }

    private Mono<ApplianceResponse> requireSuccess(ApplianceRequest request, ApplianceResponse response) {
        if (response.isSuccessful()) {
            return Mono.just(response);
        }
        return Mono.error(new ApplianceUnavailableException(
            "Appliance returned HTTP " + response.getStatus(), request.getEndpoint(), response.getStatus()));
    }

    private JsonNode readJson(ApplianceResponse response, ApiEndpoint endpoint) {
        if (response.getBody().isBlank()) {
            throw new MalformedResponseException("Empty response body", endpoint);
        }
        try {
            return objectMapper.readTree(response.getBody());
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Response is not JSON: " + e.getOriginalMessage(), endpoint, e);
        }
    }

    private List<CanonicalEvent> normalize(JsonNode body) {
        if (body.path("logs").isArray()) {
            return normalizationService.normalizeObjects(elements(body.get("logs")));
        }
        JsonNode logData = body.path("log_data");
        if (logData.isArray()) {
            return normalizationService.normalizeObjects(elements(logData));
        }
        if (logData.isTextual()) {
            return normalizationService.normalize(lines(logData.asText()));
        }
        if (body.path("raw").isTextual()) {
            return normalizationService.normalize(lines(body.get("raw").asText()));
        }
        throw new MalformedResponseException("Unrecognized log response shape", ApiEndpoint.LOGS);
    }

    private List<CanonicalEvent> applyFilter(List<CanonicalEvent> events, EventFilter filter) {
        return events.stream()
            .filter(filter::matches)
            .limit(policy.cap(filter.getLimit()))
            .collect(Collectors.toList());
    }

    private <T> RetrievalResult<T> placeholder(String operation, RetrievalException cause, T data) {
        metrics.recordError(operation);
        metrics.recordPlaceholder(operation);
        if (cause instanceof RateLimitedException || cause instanceof MalformedResponseException) {
            log.warn("Returning placeholder {}: {}", operation, cause.getMessage());
        } else {
            log.error("Appliance unavailable, returning placeholder {}: {}", operation, cause.getMessage());
        }
        return RetrievalResult.placeholder(data, cause.getMessage(), clock.instant());
    }

    private static List<JsonNode> elements(JsonNode array) {
        List<JsonNode> elements = new ArrayList<>(array.size());
        array.forEach(elements::add);
        return elements;
    }

    private static List<String> lines(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\r?\\n")) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        return lines;
    }
}

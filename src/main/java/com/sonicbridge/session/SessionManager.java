package com.sonicbridge.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sonicbridge.appliance.ApiEndpoint;
import com.sonicbridge.appliance.ApplianceRequest;
import com.sonicbridge.appliance.ApplianceResponse;
import com.sonicbridge.appliance.ApplianceTransport;
import com.sonicbridge.appliance.ApplianceUnavailableException;
import com.sonicbridge.appliance.DialectVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the single appliance session shared by all callers.
 *
 * Lock-free: concurrent refreshes may both exchange credentials, the last session
 * written wins and either one is valid. A session invalidated after a 401 is only
 * cleared if it is still the current one.
 */
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private static final String[] TOKEN_KEYS = {"token", "access_token", "auth_token"};
    private static final String[] LIFETIME_KEYS = {"expires_in", "expiry"};
    private static final String[] SESSION_ID_KEYS = {"session_id", "sessionId"};

    private final ApplianceTransport transport;
    private final DialectVersion dialect;
    private final String username;
    private final String password;
    private final Clock clock;
    private final Duration authTimeout;
    private final Duration defaultLifetime;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final AtomicReference<Session> current = new AtomicReference<>();
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.UNAUTHENTICATED);

    public SessionManager(ApplianceTransport transport, DialectVersion dialect, String username, String password,
                          Clock clock, Duration authTimeout, Duration defaultLifetime) {
        this.transport = transport;
        this.dialect = dialect;
        this.username = username;
        this.password = password;
        this.clock = clock;
        this.authTimeout = authTimeout;
        this.defaultLifetime = defaultLifetime;
    }

    /**
     * The held session if it is still valid, otherwise a freshly authenticated one
     */
    public Mono<Session> currentSession() {
        return Mono.defer(() -> {
            Session session = current.get();
            if (session != null && session.isValidAt(clock.instant())) {
                return Mono.just(session);
            }
            if (session != null) {
                state.compareAndSet(SessionState.AUTHENTICATED, SessionState.EXPIRED);
                log.info("Appliance session expired at {}, re-authenticating", session.getExpiresAt());
            }
            return authenticate();
        });
    }

    /**
     * Exchange the configured credentials for a new session
     *
     * @return the new session; errors with {@link AuthenticationException} when the
     *         credentials are refused and {@link ApplianceUnavailableException} otherwise
     */
    public Mono<Session> authenticate() {
        return Mono.defer(() -> {
            Map<String, String> payload = new LinkedHashMap<>();
            payload.put("user", username);
            payload.put("password", password);
            ApplianceRequest request = ApplianceRequest.post(dialect, ApiEndpoint.AUTH, payload);

            return transport.exchange(request)
                .timeout(authTimeout)
                .onErrorMap(TimeoutException.class, e -> new ApplianceUnavailableException(
                    "Authentication timed out after " + authTimeout.toMillis() + "ms", ApiEndpoint.AUTH, e))
                .map(this::toSession)
                .doOnNext(session -> {
                    current.set(session);
                    state.set(SessionState.AUTHENTICATED);
                    log.info("Authenticated with SonicOS {} appliance, session valid until {}",
                        dialect.getValue(), session.getExpiresAt());
                })
                .doOnError(AuthenticationException.class, e -> {
                    current.set(null);
                    state.set(SessionState.REJECTED);
                    log.error("Appliance rejected credentials: {}", e.getMessage());
                })
                .doOnError(ApplianceUnavailableException.class,
                    e -> log.warn("Authentication could not complete: {}", e.getMessage()));
        });
    }

    /**
     * Drop a session the appliance refused. No-op when another caller already replaced it.
     */
    public void invalidate(Session rejected) {
        if (current.compareAndSet(rejected, null)) {
            state.set(SessionState.REJECTED);
            log.warn("Appliance session rejected, cleared for re-authentication");
        }
    }

    /**
     * Attach the session credentials to a request
     */
    public ApplianceRequest authorize(ApplianceRequest request, Session session) {
        ApplianceRequest authorized = request.withHeader("Authorization", "Bearer " + session.getCredential());
        if (dialect.carriesSessionId() && session.getSessionId() != null) {
            authorized = authorized.withHeader("X-Session-ID", session.getSessionId());
        }
        return authorized;
    }

    /**
     * Close the session on the appliance. Local state is cleared even when the request fails.
     */
    public Mono<Void> logout() {
        return Mono.defer(() -> {
            Session session = current.getAndSet(null);
            state.set(SessionState.UNAUTHENTICATED);
            if (session == null) {
                return Mono.empty();
            }
            return transport.exchange(authorize(ApplianceRequest.delete(dialect, ApiEndpoint.AUTH), session))
                .timeout(authTimeout)
                .doOnNext(response -> log.info("Logged out from appliance (HTTP {})", response.getStatus()))
                .onErrorResume(e -> {
                    log.warn("Logout request failed: {}", e.getMessage());
                    return Mono.empty();
                })
                .then();
        });
    }

    public SessionState getState() {
        Session session = current.get();
        if (session != null && !session.isValidAt(clock.instant())) {
            return SessionState.EXPIRED;
        }
        return state.get();
    }

    public DialectVersion getDialect() {
        return dialect;
    }

    private Session toSession(ApplianceResponse response) {
        int status = response.getStatus();
        if (!response.isSuccessful()) {
            throw failureFor(status);
        }
        JsonNode body = readBody(response);
        String token = firstText(body, TOKEN_KEYS);
        if (token == null) {
            throw new AuthenticationException("No authentication token received from appliance", status);
        }
        long lifetimeSeconds = defaultLifetime.getSeconds();
        JsonNode lifetime = firstPresent(body, LIFETIME_KEYS);
        if (lifetime != null && lifetime.canConvertToLong() && lifetime.asLong() > 0) {
            lifetimeSeconds = lifetime.asLong();
        }
        String sessionId = dialect.carriesSessionId() ? firstText(body, SESSION_ID_KEYS) : null;
        Instant now = clock.instant();
        return new Session(token, sessionId, now, now.plusSeconds(lifetimeSeconds));
    }

    private RuntimeException failureFor(int status) {
        return switch (status) {
            case 401 -> new AuthenticationException("Authentication failed: invalid credentials", status);
            case 403 -> new AuthenticationException(
                "Authentication failed: API access forbidden, enable the API on the appliance", status);
            case 404 -> new ApplianceUnavailableException(
                "Authentication endpoint not found, verify the SonicOS " + dialect.getValue() + ".x API is available",
                ApiEndpoint.AUTH, status);
            case 429 -> new ApplianceUnavailableException(
                "Authentication rate limited, too many login attempts", ApiEndpoint.AUTH, status);
            default -> new ApplianceUnavailableException(
                "Authentication failed: HTTP " + status, ApiEndpoint.AUTH, status);
        };
    }

    private JsonNode readBody(ApplianceResponse response) {
        if (response.getBody().isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(response.getBody());
        } catch (JsonProcessingException e) {
            throw new AuthenticationException("Authentication response is not JSON", response.getStatus());
        }
    }

    private static JsonNode firstPresent(JsonNode body, String[] keys) {
        for (String key : keys) {
            JsonNode value = body.get(key);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static String firstText(JsonNode body, String[] keys) {
        for (String key : keys) {
            JsonNode value = body.get(key);
            if (value != null && value.isValueNode() && !value.asText().isEmpty()) {
                return value.asText();
            }
        }
        return null;
    }
}

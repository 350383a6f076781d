package com.sonicbridge.appliance;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Status, headers and body of an appliance response. Header lookup is case-insensitive.
 */
public final class ApplianceResponse {

    public static final int UNAUTHORIZED = 401;
    public static final int TOO_MANY_REQUESTS = 429;

    private final int status;
    private final Map<String, String> headers;
    private final String body;

    public ApplianceResponse(int status, Map<String, String> headers, String body) {
        this.status = status;
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body != null ? body : "";
    }

    public ApplianceResponse(int status, String body) {
        this(status, Map.of(), body);
    }

    public int getStatus() {
        return status;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getBody() {
        return body;
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public boolean isUnauthorized() {
        return status == UNAUTHORIZED;
    }

    public boolean isRateLimited() {
        return status == TOO_MANY_REQUESTS;
    }

    /**
     * Wait requested by a Retry-After header given in seconds. HTTP-date values are not honoured.
     */
    public Optional<Duration> retryAfter() {
        String value = headers.get("Retry-After");
        if (value == null) {
            return Optional.empty();
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds >= 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return "ApplianceResponse{status=" + status + ", bodyLength=" + body.length() + "}";
    }
}

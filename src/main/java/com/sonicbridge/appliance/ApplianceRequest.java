package com.sonicbridge.appliance;

import org.springframework.http.HttpMethod;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An HTTP request addressed to the appliance. Immutable; credential headers are
 * attached with {@link #withHeader(String, String)} which returns a copy.
 */
public final class ApplianceRequest {

    private final HttpMethod method;
    private final ApiEndpoint endpoint;
    private final String path;
    private final Map<String, String> queryParams;
    private final Map<String, String> headers;
    private final Object body;

    private ApplianceRequest(HttpMethod method, ApiEndpoint endpoint, String path,
                             Map<String, String> queryParams, Map<String, String> headers, Object body) {
        this.method = Objects.requireNonNull(method, "method");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.path = Objects.requireNonNull(path, "path");
        this.queryParams = Collections.unmodifiableMap(new LinkedHashMap<>(queryParams));
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body;
    }

    public static ApplianceRequest get(DialectVersion dialect, ApiEndpoint endpoint, Map<String, String> queryParams) {
        Map<String, String> headers = defaultHeaders(dialect);
        if (endpoint.getRequestType() != null) {
            headers.put("X-Request-Type", endpoint.getRequestType());
        }
        return new ApplianceRequest(HttpMethod.GET, endpoint, dialect.pathOf(endpoint), queryParams, headers, null);
    }

    public static ApplianceRequest get(DialectVersion dialect, ApiEndpoint endpoint) {
        return get(dialect, endpoint, Map.of());
    }

    public static ApplianceRequest post(DialectVersion dialect, ApiEndpoint endpoint, Object body) {
        Map<String, String> headers = defaultHeaders(dialect);
        headers.put("Content-Type", "application/json");
        return new ApplianceRequest(HttpMethod.POST, endpoint, dialect.pathOf(endpoint), Map.of(), headers, body);
    }

    public static ApplianceRequest delete(DialectVersion dialect, ApiEndpoint endpoint) {
        return new ApplianceRequest(HttpMethod.DELETE, endpoint, dialect.pathOf(endpoint), Map.of(),
            defaultHeaders(dialect), null);
    }

    private static Map<String, String> defaultHeaders(DialectVersion dialect) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "application/json");
        headers.put("X-API-Version", dialect.getApiVersionHeader());
        return headers;
    }

    /**
     * Copy of this request with one header added or replaced
     */
    public ApplianceRequest withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new ApplianceRequest(method, endpoint, path, queryParams, copy, body);
    }

    public HttpMethod getMethod() {
        return method;
    }

    public ApiEndpoint getEndpoint() {
        return endpoint;
    }

    public String getPath() {
        return path;
    }

    public Map<String, String> getQueryParams() {
        return queryParams;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Object getBody() {
        return body;
    }

    @Override
    public String toString() {
        // headers omitted: they carry the bearer token
        return method + " " + path + (queryParams.isEmpty() ? "" : " " + queryParams);
    }
}

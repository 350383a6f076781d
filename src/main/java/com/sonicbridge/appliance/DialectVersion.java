package com.sonicbridge.appliance;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

/**
 * The two supported SonicOS API/log generations.
 *
 * Each constant carries everything that differs between dialects: base path, API
 * version header, whether a session id accompanies the bearer token, log query
 * parameter names and the structured-record field table. The dialect is chosen once
 * from configuration and never re-inferred per call.
 */
public enum DialectVersion {

    V7("7", "/api/sonicos", "v1", false,
        new LogQueryNames("start-time", "end-time", "category", "count", "offset"),
        Map.of(),
        DialectFieldMapping.SONICOS_7),

    V8("8", "/api/sonicos/v8", "v8", true,
        new LogQueryNames("start_time", "end_time", "category", "limit", "offset"),
        Map.of("format", "json", "include_metadata", "true"),
        DialectFieldMapping.SONICOS_8);

    private final String value;
    private final String basePath;
    private final String apiVersionHeader;
    private final boolean sessionIdCarried;
    private final LogQueryNames logQueryNames;
    private final Map<String, String> fixedLogParameters;
    private final DialectFieldMapping fieldMapping;

    DialectVersion(String value, String basePath, String apiVersionHeader, boolean sessionIdCarried,
                   LogQueryNames logQueryNames, Map<String, String> fixedLogParameters,
                   DialectFieldMapping fieldMapping) {
        this.value = value;
        this.basePath = basePath;
        this.apiVersionHeader = apiVersionHeader;
        this.sessionIdCarried = sessionIdCarried;
        this.logQueryNames = logQueryNames;
        this.fixedLogParameters = fixedLogParameters;
        this.fieldMapping = fieldMapping;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Absolute request path of an endpoint in this dialect
     */
    public String pathOf(ApiEndpoint endpoint) {
        return basePath + endpoint.getSuffix();
    }

    public String getApiVersionHeader() {
        return apiVersionHeader;
    }

    /**
     * True when the credential exchange yields a session id that must accompany every request.
     */
    public boolean carriesSessionId() {
        return sessionIdCarried;
    }

    public LogQueryNames getLogQueryNames() {
        return logQueryNames;
    }

    /**
     * Parameters this dialect adds to every log query
     */
    public Map<String, String> getFixedLogParameters() {
        return fixedLogParameters;
    }

    public DialectFieldMapping getFieldMapping() {
        return fieldMapping;
    }

    /**
     * Parse a configured version ("7", "v7", "8", "8.x", ...) to a DialectVersion
     */
    public static DialectVersion fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            if (normalized.startsWith("v")) {
                normalized = normalized.substring(1);
            }
            for (DialectVersion version : DialectVersion.values()) {
                if (normalized.equals(version.value) || normalized.startsWith(version.value + ".")) {
                    return version;
                }
            }
        }
        throw new IllegalArgumentException("Unknown SonicOS version: " + value);
    }

    /**
     * Query parameter names for log retrieval
     */
    public static final class LogQueryNames {

        private final String startTime;
        private final String endTime;
        private final String category;
        private final String limit;
        private final String offset;

        LogQueryNames(String startTime, String endTime, String category, String limit, String offset) {
            this.startTime = startTime;
            this.endTime = endTime;
            this.category = category;
            this.limit = limit;
            this.offset = offset;
        }

        public String getStartTime() {
            return startTime;
        }

        public String getEndTime() {
            return endTime;
        }

        public String getCategory() {
            return category;
        }

        public String getLimit() {
            return limit;
        }

        public String getOffset() {
            return offset;
        }
    }
}

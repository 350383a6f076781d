package com.sonicbridge.appliance;

/**
 * SonicOS REST endpoints used by this service, relative to the dialect base path.
 */
public enum ApiEndpoint {

    /**
     * POST opens a session, DELETE closes it
     */
    AUTH("/auth", null),

    SYSTEM_INFO("/reporting/system-info", "system-info"),

    LOGS("/reporting/log", "log-query"),

    THREATS("/reporting/security-services", "threat-query"),

    DASHBOARD("/reporting/dashboard", "dashboard-query"),

    STATISTICS("/reporting/statistics", "statistics-query");

    private final String suffix;
    private final String requestType;

    ApiEndpoint(String suffix, String requestType) {
        this.suffix = suffix;
        this.requestType = requestType;
    }

    public String getSuffix() {
        return suffix;
    }

    /**
     * Value of the X-Request-Type header sent with queries to this endpoint, or null
     */
    public String getRequestType() {
        return requestType;
    }
}

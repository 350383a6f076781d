package com.sonicbridge.appliance;

/**
 * Exception thrown when the appliance cannot be reached or answers with a server error
 */
public class ApplianceUnavailableException extends RetrievalException {

    private final Integer status;

    public ApplianceUnavailableException(String message, ApiEndpoint endpoint) {
        super(message, endpoint);
        this.status = null;
    }

    public ApplianceUnavailableException(String message, ApiEndpoint endpoint, int status) {
        super(message, endpoint);
        this.status = status;
    }

    public ApplianceUnavailableException(String message, ApiEndpoint endpoint, Throwable cause) {
        super(message, endpoint, cause);
        this.status = null;
    }

    /**
     * HTTP status of the failed response, or null for transport-level failures
     */
    public Integer getStatus() {
        return status;
    }
}

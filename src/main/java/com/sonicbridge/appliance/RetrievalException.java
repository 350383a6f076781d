package com.sonicbridge.appliance;

/**
 * Base class for upstream failures that the retrieval layer recovers from by
 * returning placeholder data instead of propagating.
 */
public class RetrievalException extends RuntimeException {

    private final ApiEndpoint endpoint;

    public RetrievalException(String message, ApiEndpoint endpoint) {
        super(message);
        this.endpoint = endpoint;
    }

    public RetrievalException(String message, ApiEndpoint endpoint, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
    }

    public ApiEndpoint getEndpoint() {
        return endpoint;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (endpoint != null) {
            sb.append(" [Endpoint: ").append(endpoint).append("]");
        }
        return sb.toString();
    }
}

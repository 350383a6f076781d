package com.sonicbridge.appliance;

/**
 * Exception thrown when an appliance response body is empty or has no recognized shape
 */
public class MalformedResponseException extends RetrievalException {

    public MalformedResponseException(String message, ApiEndpoint endpoint) {
        super(message, endpoint);
    }

    public MalformedResponseException(String message, ApiEndpoint endpoint, Throwable cause) {
        super(message, endpoint, cause);
    }
}

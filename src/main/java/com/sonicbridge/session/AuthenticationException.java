package com.sonicbridge.session;

/**
 * Exception thrown when the appliance rejects the configured credentials, or rejects
 * a freshly issued session a second time. Never converted into placeholder data.
 */
public class AuthenticationException extends RuntimeException {

    private final Integer status;

    public AuthenticationException(String message, Integer status) {
        super(message);
        this.status = status;
    }

    /**
     * HTTP status of the rejecting response, if there was one
     */
    public Integer getStatus() {
        return status;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (status != null) {
            sb.append(" [Status: ").append(status).append("]");
        }
        return sb.toString();
    }
}

package com.sonicbridge.domain;

/**
 * Exception thrown when a caller-supplied event filter is structurally invalid.
 * Raised before any upstream call is attempted.
 */
public class InvalidFilterException extends RuntimeException {

    private final String field;

    public InvalidFilterException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " [Field: " + field + "]";
    }
}

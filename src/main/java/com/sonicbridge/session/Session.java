package com.sonicbridge.session;

import java.time.Instant;
import java.util.Objects;

/**
 * An authenticated appliance session. Immutable; a refresh replaces the whole session.
 */
public final class Session {

    private final String credential;
    private final String sessionId;
    private final Instant issuedAt;
    private final Instant expiresAt;

    public Session(String credential, String sessionId, Instant issuedAt, Instant expiresAt) {
        this.credential = Objects.requireNonNull(credential, "credential");
        this.sessionId = sessionId;
        this.issuedAt = Objects.requireNonNull(issuedAt, "issuedAt");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
    }

    /**
     * Bearer token sent with every request
     */
    public String getCredential() {
        return credential;
    }

    /**
     * Session id issued by 8.x appliances, otherwise null
     */
    public String getSessionId() {
        return sessionId;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public boolean isValidAt(Instant now) {
        return now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "Session{issuedAt=" + issuedAt + ", expiresAt=" + expiresAt
            + ", sessionId=" + (sessionId != null ? "present" : "none") + "}";
    }
}

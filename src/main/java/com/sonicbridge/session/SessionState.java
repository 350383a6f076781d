package com.sonicbridge.session;

/**
 * Lifecycle of the process-wide appliance session.
 */
public enum SessionState {

    /**
     * No credential exchange has happened yet, or the session was logged out
     */
    UNAUTHENTICATED,

    /**
     * A session is held and has not yet expired
     */
    AUTHENTICATED,

    /**
     * The held session passed its expiry time
     */
    EXPIRED,

    /**
     * The appliance refused the credentials or the session token
     */
    REJECTED
}

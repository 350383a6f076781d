package com.sonicbridge.cache;

/**
 * A cached value and the ticker reading at which it expires.
 */
final class CacheEntry<T> {

    private final T value;
    private final long expiresAtNanos;

    CacheEntry(T value, long expiresAtNanos) {
        this.value = value;
        this.expiresAtNanos = expiresAtNanos;
    }

    T getValue() {
        return value;
    }

    long getExpiresAtNanos() {
        return expiresAtNanos;
    }

    boolean isExpiredAt(long nowNanos) {
        return nowNanos - expiresAtNanos >= 0;
    }
}

package com.sonicbridge.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Time-bounded cache of retrieval results, keyed by operation and query.
 *
 * Backed by Caffeine with a per-entry expiry so each operation keeps its own lifetime.
 * An expired entry is never returned, even before the periodic sweep removes it.
 */
public class ResultCache {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final Cache<CacheKey, CacheEntry<?>> cache;
    private final Ticker ticker;
    private final Map<CacheOperation, Duration> defaultTtls;
    private final Counter hits;
    private final Counter misses;

    /**
     * @param defaultTtls lifetime per operation; every operation must have one
     * @param ticker      time source, {@link Ticker#systemTicker()} outside tests
     */
    public ResultCache(Map<CacheOperation, Duration> defaultTtls, long maximumSize, Ticker ticker,
                       MeterRegistry registry) {
        for (CacheOperation operation : CacheOperation.values()) {
            if (!defaultTtls.containsKey(operation)) {
                throw new IllegalArgumentException("No cache lifetime configured for " + operation);
            }
        }
        this.defaultTtls = new EnumMap<>(defaultTtls);
        this.ticker = ticker;
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .ticker(ticker)
            .expireAfter(new EntryExpiry())
            .recordStats()
            .build();
        this.hits = Counter.builder("sonicbridge.cache.hits")
            .description("Number of result cache hits")
            .register(registry);
        this.misses = Counter.builder("sonicbridge.cache.misses")
            .description("Number of result cache misses")
            .register(registry);
    }

    /**
     * Cached value for the key, or empty if absent or expired
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(CacheKey key) {
        CacheEntry<?> entry = cache.getIfPresent(key);
        if (entry != null && entry.isExpiredAt(ticker.read())) {
            cache.invalidate(key);
            entry = null;
        }
        if (entry == null) {
            misses.increment();
            return Optional.empty();
        }
        hits.increment();
        return Optional.of((T) entry.getValue());
    }

    /**
     * Store a value with an explicit lifetime, replacing any existing entry
     */
    public <T> void put(CacheKey key, T value, Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache lifetime must be positive: " + ttl);
        }
        cache.put(key, new CacheEntry<>(value, ticker.read() + ttl.toNanos()));
        log.debug("Cached {} for {}s", key, ttl.getSeconds());
    }

    /**
     * Store a value with its operation's default lifetime
     */
    public <T> void put(CacheKey key, T value) {
        put(key, value, defaultTtls.get(key.getOperation()));
    }

    public void invalidate(CacheKey key) {
        cache.invalidate(key);
    }

    public void clear() {
        cache.invalidateAll();
        log.info("Result cache cleared");
    }

    public long size() {
        return cache.estimatedSize();
    }

    /**
     * Remove expired entries. Reads never depend on this having run.
     */
    @Scheduled(fixedDelayString = "${sonicbridge.cache.sweep-interval-ms:60000}")
    public void sweep() {
        cache.cleanUp();
        log.debug("Result cache swept, {} entries remain", cache.estimatedSize());
    }

    public CacheSnapshot stats() {
        CacheStats stats = cache.stats();
        return new CacheSnapshot(cache.estimatedSize(), (long) hits.count(), (long) misses.count(),
            stats.evictionCount());
    }

    private static final class EntryExpiry implements Expiry<CacheKey, CacheEntry<?>> {

        @Override
        public long expireAfterCreate(CacheKey key, CacheEntry<?> entry, long currentTime) {
            return Math.max(0, entry.getExpiresAtNanos() - currentTime);
        }

        @Override
        public long expireAfterUpdate(CacheKey key, CacheEntry<?> entry, long currentTime, long currentDuration) {
            return Math.max(0, entry.getExpiresAtNanos() - currentTime);
        }

        @Override
        public long expireAfterRead(CacheKey key, CacheEntry<?> entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}

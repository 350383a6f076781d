package com.sonicbridge.service;

import com.sonicbridge.cache.CacheKey;
import com.sonicbridge.cache.CacheOperation;
import com.sonicbridge.cache.CacheSnapshot;
import com.sonicbridge.cache.ResultCache;
import com.sonicbridge.domain.CanonicalEvent;
import com.sonicbridge.domain.ConnectivityResult;
import com.sonicbridge.domain.EventFilter;
import com.sonicbridge.domain.ParsingStats;
import com.sonicbridge.domain.RetrievalResult;
import com.sonicbridge.domain.SystemStats;
import com.sonicbridge.domain.ThreatRecord;
import com.sonicbridge.normalization.NormalizationService;
import com.sonicbridge.retrieval.RetrievalClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry point for the tool layer: cached event, threat and statistics retrieval,
 * connectivity checks and parsing diagnostics.
 *
 * Only live results are cached; placeholder data is recomputed on every call so the
 * appliance is retried as soon as it recovers.
 */
@Service
public class FirewallLogService {

    private static final Logger log = LoggerFactory.getLogger(FirewallLogService.class);

    private final RetrievalClient retrievalClient;
    private final ResultCache resultCache;
    private final NormalizationService normalizationService;

    public FirewallLogService(RetrievalClient retrievalClient, ResultCache resultCache,
                              NormalizationService normalizationService) {
        this.retrievalClient = retrievalClient;
        this.resultCache = resultCache;
        this.normalizationService = normalizationService;
    }

    /**
     * Events matching the filter, newest first
     *
     * @throws com.sonicbridge.domain.InvalidFilterException immediately, before any upstream call
     */
    public Mono<RetrievalResult<List<CanonicalEvent>>> getEvents(EventFilter filter) {
        filter.validate();
        return cached(CacheKey.of(CacheOperation.LOGS, filter), () -> retrievalClient.fetchEvents(filter));
    }

    public Mono<RetrievalResult<List<ThreatRecord>>> getThreats() {
        return cached(CacheKey.of(CacheOperation.THREATS), retrievalClient::fetchThreats);
    }

    public Mono<RetrievalResult<SystemStats>> getAggregateStats() {
        return cached(CacheKey.of(CacheOperation.STATS), retrievalClient::fetchStats);
    }

    public Mono<ConnectivityResult> testConnectivity() {
        return retrievalClient.testConnectivity();
    }

    /**
     * How the given raw units would be recognized by the configured dialect
     */
    public ParsingStats getParsingStats(List<String> units) {
        return normalizationService.summarize(units);
    }

    public void clearCache() {
        resultCache.clear();
    }

    public CacheSnapshot getCacheStats() {
        return resultCache.stats();
    }

    private <T> Mono<RetrievalResult<T>> cached(CacheKey key, Supplier<Mono<RetrievalResult<T>>> upstream) {
        return Mono.defer(() -> {
            Optional<RetrievalResult<T>> hit = resultCache.get(key);
            if (hit.isPresent()) {
                log.debug("Cache hit for {}", key);
                return Mono.just(hit.get());
            }
            return upstream.get().doOnNext(result -> {
                if (!result.isPlaceholder()) {
                    resultCache.put(key, result);
                }
            });
        });
    }
}

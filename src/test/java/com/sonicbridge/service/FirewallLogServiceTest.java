package com.sonicbridge.service;

import com.github.benmanes.caffeine.cache.Ticker;
import com.sonicbridge.cache.CacheOperation;
import com.sonicbridge.cache.ResultCache;
import com.sonicbridge.domain.CanonicalEvent;
import com.sonicbridge.domain.ConnectivityResult;
import com.sonicbridge.domain.EventFilter;
import com.sonicbridge.domain.InvalidFilterException;
import com.sonicbridge.domain.ParsingStats;
import com.sonicbridge.domain.RetrievalResult;
import com.sonicbridge.domain.SystemStats;
import com.sonicbridge.domain.ThreatRecord;
import com.sonicbridge.normalization.NormalizationService;
import com.sonicbridge.retrieval.RetrievalClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("FirewallLogService Tests")
class FirewallLogServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-15T12:00:00Z");

    @Mock
    private RetrievalClient retrievalClient;

    @Mock
    private NormalizationService normalizationService;

    private final AtomicLong nanos = new AtomicLong();
    private ResultCache resultCache;
    private FirewallLogService service;

    @BeforeEach
    void setUp() {
        Map<CacheOperation, Duration> ttls = new EnumMap<>(CacheOperation.class);
        ttls.put(CacheOperation.LOGS, Duration.ofSeconds(120));
        ttls.put(CacheOperation.THREATS, Duration.ofSeconds(60));
        ttls.put(CacheOperation.STATS, Duration.ofSeconds(300));
        Ticker ticker = nanos::get;
        resultCache = new ResultCache(ttls, 100, ticker, new SimpleMeterRegistry());
        service = new FirewallLogService(retrievalClient, resultCache, normalizationService);
    }

    private static RetrievalResult<List<CanonicalEvent>> liveEvents() {
        CanonicalEvent event = CanonicalEvent.builder("raw").timestamp(NOW).build();
        return RetrievalResult.live(List.of(event), NOW);
    }

    // ========== Validation ==========

    @Test
    void testGetEvents_WithInvalidFilter_ShouldThrowBeforeAnyUpstreamCall() {
        EventFilter invalid = EventFilter.builder()
            .startTime(NOW)
            .endTime(NOW.minusSeconds(60))
            .build();

        assertThatThrownBy(() -> service.getEvents(invalid)).isInstanceOf(InvalidFilterException.class);
        verifyNoInteractions(retrievalClient);
    }

    // ========== Caching ==========

    @Test
    void testGetEvents_WithSameFilterTwice_ShouldServeSecondFromCache() {
        // Given
        EventFilter filter = EventFilter.builder().limit(10).build();
        RetrievalResult<List<CanonicalEvent>> live = liveEvents();
        when(retrievalClient.fetchEvents(filter)).thenReturn(Mono.just(live));

        // When
        RetrievalResult<List<CanonicalEvent>> first = service.getEvents(filter).block();
        RetrievalResult<List<CanonicalEvent>> second = service.getEvents(EventFilter.builder().limit(10).build())
            .block();

        // Then
        assertThat(first).isSameAs(live);
        assertThat(second).isSameAs(live);
        verify(retrievalClient, times(1)).fetchEvents(filter);
        assertThat(service.getCacheStats().getHits()).isEqualTo(1);
    }

    @Test
    void testGetEvents_AfterTtl_ShouldFetchAgain() {
        EventFilter filter = EventFilter.builder().build();
        when(retrievalClient.fetchEvents(filter)).thenReturn(Mono.just(liveEvents()));

        service.getEvents(filter).block();
        nanos.addAndGet(Duration.ofSeconds(121).toNanos());
        service.getEvents(filter).block();

        verify(retrievalClient, times(2)).fetchEvents(filter);
    }

    @Test
    void testGetThreats_WhenPlaceholder_ShouldNotCache() {
        RetrievalResult<List<ThreatRecord>> placeholder =
            RetrievalResult.placeholder(Collections.emptyList(), "Appliance returned HTTP 500", NOW);
        when(retrievalClient.fetchThreats()).thenReturn(Mono.just(placeholder));

        StepVerifier.create(service.getThreats())
            .assertNext(result -> assertThat(result.isPlaceholder()).isTrue())
            .verifyComplete();
        service.getThreats().block();

        verify(retrievalClient, times(2)).fetchThreats();
        assertThat(resultCache.size()).isZero();
    }

    @Test
    void testClearCache_ShouldForceRefetch() {
        when(retrievalClient.fetchStats()).thenReturn(Mono.just(RetrievalResult.live(SystemStats.empty(), NOW)));

        service.getAggregateStats().block();
        service.clearCache();
        service.getAggregateStats().block();

        verify(retrievalClient, times(2)).fetchStats();
    }

    // ========== Pass-through ==========

    @Test
    void testTestConnectivity_ShouldNotBeCached() {
        when(retrievalClient.testConnectivity()).thenReturn(Mono.just(ConnectivityResult.connected("SonicOS 7.1")));

        service.testConnectivity().block();
        service.testConnectivity().block();

        verify(retrievalClient, times(2)).testConnectivity();
    }

    @Test
    void testGetParsingStats_ShouldDelegateToNormalization() {
        ParsingStats stats = new ParsingStats(1, 0, 1, Map.of(), Map.of(), Map.of("fallback", 1L));
        when(normalizationService.summarize(List.of("x"))).thenReturn(stats);

        assertThat(service.getParsingStats(List.of("x"))).isSameAs(stats);
    }
}

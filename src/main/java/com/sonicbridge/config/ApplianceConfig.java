package com.sonicbridge.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.sonicbridge.appliance.ApplianceTransport;
import com.sonicbridge.appliance.DialectVersion;
import com.sonicbridge.appliance.WebClientApplianceTransport;
import com.sonicbridge.cache.CacheOperation;
import com.sonicbridge.cache.ResultCache;
import com.sonicbridge.normalization.NormalizationService;
import com.sonicbridge.normalization.TimestampNormalizer;
import com.sonicbridge.retrieval.PlaceholderResults;
import com.sonicbridge.retrieval.RetrievalClient;
import com.sonicbridge.retrieval.RetrievalMetrics;
import com.sonicbridge.retrieval.RetrievalPolicy;
import com.sonicbridge.retrieval.StatsResponseMapper;
import com.sonicbridge.retrieval.ThreatResponseMapper;
import com.sonicbridge.session.SessionManager;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration for the appliance connection, session, retrieval and result cache.
 */
@Configuration
public class ApplianceConfig {

    private static final Logger log = LoggerFactory.getLogger(ApplianceConfig.class);

    @Value("${sonicbridge.appliance.host:localhost}")
    private String host;

    @Value("${sonicbridge.appliance.scheme:https}")
    private String scheme;

    @Value("${sonicbridge.appliance.username:}")
    private String username;

    @Value("${sonicbridge.appliance.password:}")
    private String password;

    @Value("${sonicbridge.appliance.version:7}")
    private String version;

    @Value("${sonicbridge.appliance.request-timeout-ms:30000}")
    private long requestTimeoutMs;

    @Value("${sonicbridge.appliance.auth-timeout-ms:10000}")
    private long authTimeoutMs;

    @Value("${sonicbridge.appliance.default-session-lifetime-seconds:3600}")
    private long defaultSessionLifetimeSeconds;

    @Value("${sonicbridge.appliance.rate-limit.default-wait-ms:5000}")
    private long defaultRateLimitWaitMs;

    @Value("${sonicbridge.appliance.rate-limit.max-wait-ms:30000}")
    private long maxRateLimitWaitMs;

    @Value("${sonicbridge.appliance.max-records:10000}")
    private int maxRecords;

    @Value("${sonicbridge.cache.logs-ttl-seconds:120}")
    private long logsTtlSeconds;

    @Value("${sonicbridge.cache.threats-ttl-seconds:60}")
    private long threatsTtlSeconds;

    @Value("${sonicbridge.cache.stats-ttl-seconds:300}")
    private long statsTtlSeconds;

    @Value("${sonicbridge.cache.maximum-size:10000}")
    private long cacheMaximumSize;

    private SessionManager sessionManager;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DialectVersion dialectVersion() {
        DialectVersion dialect = DialectVersion.fromValue(version);
        log.info("Configured for SonicOS {}.x at {}://{}", dialect.getValue(), scheme, host);
        return dialect;
    }

    @Bean
    public ApplianceTransport applianceTransport(WebClient.Builder webClientBuilder) {
        // Opens after half of the last 10 calls fail, half-open after 30 seconds
        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .slidingWindowSize(10)
            .minimumNumberOfCalls(5)
            .build();

        WebClient webClient = webClientBuilder
            .baseUrl(scheme + "://" + host)
            .build();
        return new WebClientApplianceTransport(webClient, CircuitBreaker.of("appliance", cbConfig));
    }

    @Bean
    public SessionManager sessionManager(ApplianceTransport transport, DialectVersion dialect, Clock clock) {
        if (username.isBlank()) {
            log.warn("sonicbridge.appliance.username is not set, authentication will be refused");
        }
        this.sessionManager = new SessionManager(transport, dialect, username, password, clock,
            Duration.ofMillis(authTimeoutMs), Duration.ofSeconds(defaultSessionLifetimeSeconds));
        return sessionManager;
    }

    @Bean
    public RetrievalClient retrievalClient(ApplianceTransport transport, SessionManager sessionManager,
                                           NormalizationService normalizationService,
                                           TimestampNormalizer timestampNormalizer,
                                           MeterRegistry meterRegistry, Clock clock) {
        RetrievalPolicy policy = new RetrievalPolicy(
            Duration.ofMillis(requestTimeoutMs),
            Duration.ofMillis(defaultRateLimitWaitMs),
            Duration.ofMillis(maxRateLimitWaitMs),
            maxRecords);
        return new RetrievalClient(transport, sessionManager, normalizationService,
            new ThreatResponseMapper(timestampNormalizer), new StatsResponseMapper(),
            new PlaceholderResults(clock), new RetrievalMetrics(meterRegistry), policy, clock);
    }

    @Bean
    public ResultCache resultCache(MeterRegistry meterRegistry) {
        Map<CacheOperation, Duration> ttls = new EnumMap<>(CacheOperation.class);
        ttls.put(CacheOperation.LOGS, Duration.ofSeconds(logsTtlSeconds));
        ttls.put(CacheOperation.THREATS, Duration.ofSeconds(threatsTtlSeconds));
        ttls.put(CacheOperation.STATS, Duration.ofSeconds(statsTtlSeconds));
        return new ResultCache(ttls, cacheMaximumSize, Ticker.systemTicker(), meterRegistry);
    }

    /**
     * Close the appliance session on shutdown
     */
    @PreDestroy
    public void close() {
        if (sessionManager != null) {
            sessionManager.logout().block(Duration.ofMillis(authTimeoutMs));
        }
    }
}

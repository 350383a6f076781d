package com.sonicbridge.cache;

import com.sonicbridge.domain.EventCategory;
import com.sonicbridge.domain.EventFilter;
import com.sonicbridge.domain.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CacheKey Tests")
class CacheKeyTest {

    @Test
    void testOf_WithEqualFiltersBuiltInDifferentOrder_ShouldProduceEqualKeys() {
        EventFilter first = EventFilter.builder()
            .category(EventCategory.IPS)
            .startTime(Instant.parse("2024-01-15T00:00:00Z"))
            .severities(List.of(Severity.HIGH, Severity.CRITICAL))
            .limit(50)
            .build();
        EventFilter second = EventFilter.builder()
            .limit(50)
            .severities(List.of(Severity.CRITICAL, Severity.HIGH))
            .startTime(Instant.parse("2024-01-15T00:00:00Z"))
            .category(EventCategory.IPS)
            .build();

        CacheKey a = CacheKey.of(CacheOperation.LOGS, first);
        CacheKey b = CacheKey.of(CacheOperation.LOGS, second);

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a.getValue()).startsWith("logs:");
    }

    @Test
    void testOf_WithDifferentParameters_ShouldProduceDifferentKeys() {
        CacheKey fifty = CacheKey.of(CacheOperation.LOGS, EventFilter.builder().limit(50).build());
        CacheKey hundred = CacheKey.of(CacheOperation.LOGS, EventFilter.builder().limit(100).build());

        assertThat(fifty).isNotEqualTo(hundred);
    }

    @Test
    void testOf_WithoutParameters_ShouldUseCurrentSuffix() {
        CacheKey key = CacheKey.of(CacheOperation.THREATS);

        assertThat(key.getValue()).isEqualTo("threats:current");
        assertThat(key.getOperation()).isEqualTo(CacheOperation.THREATS);
    }
}

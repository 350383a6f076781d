package com.sonicbridge.normalization.parsers;

import com.sonicbridge.domain.CanonicalEvent;
import com.sonicbridge.domain.EventAction;
import com.sonicbridge.domain.EventCategory;
import com.sonicbridge.domain.Severity;
import com.sonicbridge.normalization.TimestampNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FallbackEventParser Tests")
class FallbackEventParserTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private FallbackEventParser parser;

    @BeforeEach
    void setUp() {
        parser = new FallbackEventParser(new TimestampNormalizer(Clock.fixed(NOW, ZoneOffset.UTC)));
    }

    @Test
    void testParse_WithTwoAddresses_ShouldUseThemAsSourceAndDest() {
        // Given
        String garbage = "%%garbled%% 10.0.0.1 -> 10.0.0.2 ??? 10.0.0.3";

        // When
        CanonicalEvent event = parser.parse(garbage).orElseThrow();

        // Then
        assertThat(event.getSourceAddress()).isEqualTo("10.0.0.1");
        assertThat(event.getDestAddress()).isEqualTo("10.0.0.2");
        assertThat(event.getAction()).isEqualTo(EventAction.DENY);
        assertThat(event.getSeverity()).isEqualTo(Severity.INFO);
        assertThat(event.getCategory()).isEqualTo(EventCategory.SYSTEM);
        assertThat(event.getTimestamp()).isEqualTo(NOW);
        assertThat(event.getMessage()).isEqualTo("Unparsed log entry: " + garbage);
        assertThat(event.getRaw()).isEqualTo(garbage);
    }

    @Test
    void testParse_ShouldReadActionKeywordAsPrefix() {
        assertThat(parser.parse("traffic ALLOWED somewhere").orElseThrow().getAction()).isEqualTo(EventAction.ALLOW);
        assertThat(parser.parse("packet dropped").orElseThrow().getAction()).isEqualTo(EventAction.DROP);
        assertThat(parser.parse("BLOCKED by policy").orElseThrow().getAction()).isEqualTo(EventAction.DENY);
    }

    @Test
    void testParse_WithEmptyUnit_ShouldStillProduceEvent() {
        CanonicalEvent event = parser.parse("").orElseThrow();

        assertThat(event.getRaw()).isEmpty();
        assertThat(event.getSourceAddress()).isEqualTo(CanonicalEvent.UNKNOWN_ADDRESS);
        assertThat(event.getDestAddress()).isEqualTo(CanonicalEvent.UNKNOWN_ADDRESS);
        assertThat(event.getAction()).isEqualTo(EventAction.DENY);
    }

    @Test
    void testParse_WithLongUnit_ShouldTruncateMessageButKeepRaw() {
        String longUnit = "x".repeat(250);

        CanonicalEvent event = parser.parse(longUnit).orElseThrow();

        assertThat(event.getMessage())
            .isEqualTo("Unparsed log entry: " + "x".repeat(FallbackEventParser.MESSAGE_EXCERPT_LENGTH) + "...");
        assertThat(event.getRaw()).hasSize(250);
    }
}

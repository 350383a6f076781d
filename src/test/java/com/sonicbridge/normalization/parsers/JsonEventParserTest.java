package com.sonicbridge.normalization.parsers;

import com.sonicbridge.appliance.DialectVersion;
import com.sonicbridge.domain.CanonicalEvent;
import com.sonicbridge.domain.EventAction;
import com.sonicbridge.domain.EventCategory;
import com.sonicbridge.domain.Protocol;
import com.sonicbridge.domain.Severity;
import com.sonicbridge.normalization.TimestampNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JsonEventParser Tests")
class JsonEventParserTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private static final String V8_RECORD = "{\"id\":\"evt-1\",\"timestamp\":\"2024-01-15T09:00:00Z\","
        + "\"severity\":\"critical\",\"category\":\"antivirus\",\"action\":\"blocked\","
        + "\"source_ip\":\"1.2.3.4\",\"dest_ip\":\"5.6.7.8\",\"dest_port\":\"443\",\"protocol\":\"tcp\","
        + "\"message\":\"Malware blocked\",\"cloud_id\":\"c-1\",\"analysis_time\":250}";

    private TimestampNormalizer timestamps;

    @BeforeEach
    void setUp() {
        timestamps = new TimestampNormalizer(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testParse_WithSonicOs8Record_ShouldMapExtensionFields() {
        // Given
        JsonEventParser parser = new JsonEventParser(DialectVersion.V8.getFieldMapping(), timestamps);

        // When
        CanonicalEvent event = parser.parse(V8_RECORD).orElseThrow();

        // Then
        assertThat(event.getId()).isEqualTo("evt-1");
        assertThat(event.getTimestamp()).isEqualTo(Instant.parse("2024-01-15T09:00:00Z"));
        assertThat(event.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(event.getCategory()).isEqualTo(EventCategory.ANTIVIRUS);
        assertThat(event.getAction()).isEqualTo(EventAction.DENY);
        assertThat(event.getDestPort()).isEqualTo(443);
        assertThat(event.getProtocol()).isEqualTo(Protocol.TCP);
        assertThat(event.getCloudId()).isEqualTo("c-1");
        assertThat(event.getAnalysisTimeMs()).isEqualTo(250L);
        assertThat(event.getParser()).isEqualTo("json");
    }

    @Test
    void testParse_WithSonicOs7Mapping_ShouldIgnoreExtensionFields() {
        JsonEventParser parser = new JsonEventParser(DialectVersion.V7.getFieldMapping(), timestamps);

        CanonicalEvent event = parser.parse(V8_RECORD).orElseThrow();

        assertThat(event.getCloudId()).isNull();
        assertThat(event.getAnalysisTimeMs()).isNull();
    }

    @Test
    void testParse_WhenPortOverflowsLong_ShouldLeavePortAbsent() {
        JsonEventParser parser = new JsonEventParser(DialectVersion.V8.getFieldMapping(), timestamps);
        String record = "{\"timestamp\":\"2024-01-15T09:00:00Z\",\"action\":\"allow\","
            + "\"src_port\":18446744073709551696,\"dest_port\":1e3}";

        CanonicalEvent event = parser.parse(record).orElseThrow();

        assertThat(event.getSourcePort()).isNull();
        assertThat(event.getDestPort()).isEqualTo(1000);
    }

    @Test
    void testParse_WithAlternateKeys_ShouldResolveAliases() {
        JsonEventParser parser = new JsonEventParser(DialectVersion.V7.getFieldMapping(), timestamps);
        String record = "{\"time\":\"1705314645\",\"priority\":3,\"log_type\":\"vpn\",\"disposition\":\"allowed\","
            + "\"src_ip\":\"10.0.0.1\",\"srcPort\":5000,\"dst_ip\":\"10.0.0.2\",\"description\":\"Tunnel up\"}";

        CanonicalEvent event = parser.parse(record).orElseThrow();

        assertThat(event.getTimestamp()).isEqualTo(Instant.parse("2024-01-15T10:30:45Z"));
        assertThat(event.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(event.getCategory()).isEqualTo(EventCategory.VPN);
        assertThat(event.getAction()).isEqualTo(EventAction.ALLOW);
        assertThat(event.getSourceAddress()).isEqualTo("10.0.0.1");
        assertThat(event.getSourcePort()).isEqualTo(5000);
        assertThat(event.getMessage()).isEqualTo("Tunnel up");
    }

    @Test
    void testParse_WithMissingFields_ShouldApplyDefaults() {
        JsonEventParser parser = new JsonEventParser(DialectVersion.V7.getFieldMapping(), timestamps);

        CanonicalEvent event = parser.parse("{}").orElseThrow();

        assertThat(event.getId()).isNotBlank();
        assertThat(event.getTimestamp()).isEqualTo(NOW);
        assertThat(event.getSeverity()).isEqualTo(Severity.INFO);
        assertThat(event.getCategory()).isEqualTo(EventCategory.SYSTEM);
        assertThat(event.getAction()).isEqualTo(EventAction.DENY);
        assertThat(event.getSourceAddress()).isEqualTo(CanonicalEvent.UNKNOWN_ADDRESS);
        assertThat(event.getRule()).isEqualTo(CanonicalEvent.NO_RULE);
        assertThat(event.getMessage()).isEqualTo(CanonicalEvent.DEFAULT_MESSAGE);
    }

    @Test
    void testParse_WithNonObjectOrBrokenJson_ShouldNotMatch() {
        JsonEventParser parser = new JsonEventParser(DialectVersion.V7.getFieldMapping(), timestamps);

        assertThat(parser.parse("[1,2,3]")).isEmpty();
        assertThat(parser.parse("{\"id\": ")).isEmpty();
        assertThat(parser.parse("plain text")).isEmpty();
    }
}

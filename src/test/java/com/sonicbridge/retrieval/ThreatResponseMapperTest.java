package com.sonicbridge.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sonicbridge.appliance.MalformedResponseException;
import com.sonicbridge.domain.ThreatRecord;
import com.sonicbridge.domain.ThreatSeverity;
import com.sonicbridge.domain.ThreatType;
import com.sonicbridge.normalization.TimestampNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ThreatResponseMapper Tests")
class ThreatResponseMapperTest {

    private static final Instant NOW = Instant.parse("2024-01-15T12:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ThreatResponseMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ThreatResponseMapper(new TimestampNormalizer(Clock.fixed(NOW, ZoneOffset.UTC)));
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void testMap_WithThreatList_ShouldOrderBySeverityThenRecency() throws Exception {
        // Given
        JsonNode body = json("{\"threats\":["
            + "{\"id\":\"t1\",\"severity\":\"medium\",\"type\":\"spam\",\"timestamp\":\"2024-01-15T11:00:00Z\"},"
            + "{\"id\":\"t2\",\"severity\":\"critical\",\"type\":\"malware\",\"timestamp\":\"2024-01-15T09:00:00Z\"},"
            + "{\"id\":\"t3\",\"severity\":\"critical\",\"type\":\"botnet\",\"timestamp\":\"2024-01-15T10:00:00Z\"}]}");

        // When
        List<ThreatRecord> threats = mapper.map(body);

        // Then
        assertThat(threats).extracting(ThreatRecord::getId).containsExactly("t3", "t2", "t1");
        assertThat(threats).extracting(ThreatRecord::getType)
            .containsExactly(ThreatType.BOTNET, ThreatType.MALWARE, ThreatType.SPAM);
    }

    @Test
    void testMap_WithThreatList_ShouldDeriveBlockedFlag() throws Exception {
        JsonNode body = json("{\"threats\":["
            + "{\"id\":\"a\",\"action\":\"allow\"},"
            + "{\"id\":\"b\",\"blocked\":false},"
            + "{\"id\":\"c\",\"action\":\"quarantined\"}]}");

        List<ThreatRecord> threats = mapper.map(body);

        assertThat(threats).filteredOn(ThreatRecord::isBlocked).extracting(ThreatRecord::getId).containsExactly("c");
    }

    @Test
    void testMap_WithStatisticsShape_ShouldReportIntrusions() throws Exception {
        JsonNode body = json("{\"statistics\":{\"intrusion_attempts\":["
            + "{\"source_ip\":\"203.0.113.7\",\"target_ip\":\"10.0.0.2\",\"signature\":\"Port scan\"}]}}");

        ThreatRecord threat = mapper.map(body).get(0);

        assertThat(threat.getType()).isEqualTo(ThreatType.INTRUSION);
        assertThat(threat.getSeverity()).isEqualTo(ThreatSeverity.HIGH);
        assertThat(threat.getDescription()).isEqualTo("Port scan");
        assertThat(threat.getTimestamp()).isEqualTo(NOW);
        assertThat(threat.isBlocked()).isTrue();
    }

    @Test
    void testMap_WithUnknownShape_ShouldFail() throws Exception {
        JsonNode body = json("{\"alerts\":[]}");

        assertThatThrownBy(() -> mapper.map(body)).isInstanceOf(MalformedResponseException.class);
    }
}

package com.sonicbridge.retrieval;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sonicbridge.appliance.ApiEndpoint;
import com.sonicbridge.appliance.MalformedResponseException;
import com.sonicbridge.domain.AddressCount;
import com.sonicbridge.domain.CanonicalEvent;
import com.sonicbridge.domain.EventAction;
import com.sonicbridge.domain.EventCategory;
import com.sonicbridge.domain.PortCount;
import com.sonicbridge.domain.Protocol;
import com.sonicbridge.domain.SystemStats;
import com.sonicbridge.domain.ThreatCount;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StatsResponseMapper Tests")
class StatsResponseMapperTest {

    private final StatsResponseMapper mapper = new StatsResponseMapper();

    private static CanonicalEvent event(String source, EventAction action, EventCategory category, Integer port) {
        return CanonicalEvent.builder("raw")
            .timestamp(Instant.parse("2024-01-15T10:00:00Z"))
            .sourceAddress(source)
            .action(action)
            .category(category)
            .destPort(port)
            .protocol(Protocol.TCP)
            .build();
    }

    // ========== Derivation ==========

    @Test
    void testDerive_ShouldRankBlockedAndAllowedSourcesSeparately() {
        // Given
        List<CanonicalEvent> events = List.of(
            event("10.0.0.1", EventAction.DENY, EventCategory.FIREWALL, 443),
            event("10.0.0.1", EventAction.DROP, EventCategory.IPS, 22),
            event("10.0.0.2", EventAction.DENY, EventCategory.FIREWALL, 443),
            event("10.0.0.3", EventAction.ALLOW, EventCategory.FIREWALL, 443),
            event("10.0.0.3", EventAction.ALLOW, EventCategory.ANTIVIRUS, null),
            event("10.0.0.4", EventAction.RESET, EventCategory.FIREWALL, 80));

        // When
        SystemStats stats = mapper.derive(events);

        // Then
        assertThat(stats.getTotalConnections()).isEqualTo(6);
        assertThat(stats.getBlockedConnections()).isEqualTo(3);
        assertThat(stats.getAllowedConnections()).isEqualTo(3);
        assertThat(stats.getTopBlockedAddresses()).extracting(AddressCount::getAddress)
            .containsExactly("10.0.0.1", "10.0.0.2");
        assertThat(stats.getTopAllowedAddresses()).extracting(AddressCount::getAddress)
            .containsExactly("10.0.0.3", "10.0.0.4");
        assertThat(stats.getPortSummary()).first()
            .satisfies(port -> {
                assertThat(port.getPort()).isEqualTo(443);
                assertThat(port.getCount()).isEqualTo(3);
            });
        assertThat(stats.getThreatSummary()).extracting(ThreatCount::getType)
            .containsExactlyInAnyOrder("ips", "antivirus");
    }

    @Test
    void testDerive_ShouldKeepOnlyTopTen() {
        List<CanonicalEvent> events = new ArrayList<>();
        for (int i = 1; i <= 15; i++) {
            for (int repeat = 0; repeat < i; repeat++) {
                events.add(event("10.0.1." + i, EventAction.DENY, EventCategory.FIREWALL, 1000 + i));
            }
        }

        SystemStats stats = mapper.derive(events);

        assertThat(stats.getTopBlockedAddresses()).hasSize(StatsResponseMapper.TOP_N);
        assertThat(stats.getTopBlockedAddresses().get(0).getAddress()).isEqualTo("10.0.1.15");
        assertThat(stats.getPortSummary()).hasSize(StatsResponseMapper.TOP_N)
            .extracting(PortCount::getPort).first().isEqualTo(1015);
    }

    @Test
    void testDerive_WithNoEvents_ShouldBeEmpty() {
        SystemStats stats = mapper.derive(List.of());

        assertThat(stats.getTotalConnections()).isZero();
        assertThat(stats.getTopBlockedAddresses()).isEmpty();
    }

    // ========== Payload mapping ==========

    @Test
    void testMap_ShouldReadAliasedFields() throws Exception {
        SystemStats stats = mapper.map(new ObjectMapper().readTree("{\"connection_count\":50,"
            + "\"denied_connections\":20,\"permitted_connections\":30,"
            + "\"blocked_sources\":[{\"address\":\"1.2.3.4\",\"connections\":9}],"
            + "\"service_summary\":[{\"port\":53,\"protocol\":\"UDP\",\"count\":12}]}"), ApiEndpoint.STATISTICS);

        assertThat(stats.getTotalConnections()).isEqualTo(50);
        assertThat(stats.getBlockedConnections()).isEqualTo(20);
        assertThat(stats.getTopBlockedAddresses()).singleElement()
            .satisfies(entry -> assertThat(entry.getCount()).isEqualTo(9));
        assertThat(stats.getPortSummary()).singleElement()
            .satisfies(port -> assertThat(port.getProtocol()).isEqualTo("UDP"));
    }

    @Test
    void testMap_WhenPortIsOutOfRange_ShouldSkipEntry() throws Exception {
        SystemStats stats = mapper.map(new ObjectMapper().readTree("{\"port_summary\":["
            + "{\"port\":18446744073709551696,\"count\":4},{\"port\":70000,\"count\":2},"
            + "{\"port\":\"443\",\"count\":7}]}"), ApiEndpoint.DASHBOARD);

        assertThat(stats.getPortSummary()).singleElement()
            .satisfies(port -> {
                assertThat(port.getPort()).isEqualTo(443);
                assertThat(port.getCount()).isEqualTo(7);
            });
    }

    @Test
    void testMap_WithNonObject_ShouldFail() throws Exception {
        assertThatThrownBy(() -> mapper.map(new ObjectMapper().readTree("[]"), ApiEndpoint.DASHBOARD))
            .isInstanceOf(MalformedResponseException.class);
    }
}

package com.sonicbridge.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Aggregate connection and threat statistics for the appliance.
 */
public final class SystemStats {

    @JsonProperty("total_connections")
    private final long totalConnections;

    @JsonProperty("blocked_connections")
    private final long blockedConnections;

    @JsonProperty("allowed_connections")
    private final long allowedConnections;

    @JsonProperty("top_blocked_addresses")
    private final List<AddressCount> topBlockedAddresses;

    @JsonProperty("top_allowed_addresses")
    private final List<AddressCount> topAllowedAddresses;

    @JsonProperty("port_summary")
    private final List<PortCount> portSummary;

    @JsonProperty("threat_summary")
    private final List<ThreatCount> threatSummary;

    public SystemStats(long totalConnections, long blockedConnections, long allowedConnections,
                       List<AddressCount> topBlockedAddresses, List<AddressCount> topAllowedAddresses,
                       List<PortCount> portSummary, List<ThreatCount> threatSummary) {
        this.totalConnections = totalConnections;
        this.blockedConnections = blockedConnections;
        this.allowedConnections = allowedConnections;
        this.topBlockedAddresses = topBlockedAddresses != null ? List.copyOf(topBlockedAddresses) : List.of();
        this.topAllowedAddresses = topAllowedAddresses != null ? List.copyOf(topAllowedAddresses) : List.of();
        this.portSummary = portSummary != null ? List.copyOf(portSummary) : List.of();
        this.threatSummary = threatSummary != null ? List.copyOf(threatSummary) : List.of();
    }

    /**
     * Statistics with every counter at zero
     */
    public static SystemStats empty() {
        return new SystemStats(0, 0, 0, List.of(), List.of(), List.of(), List.of());
    }

    public long getTotalConnections() {
        return totalConnections;
    }

    public long getBlockedConnections() {
        return blockedConnections;
    }

    public long getAllowedConnections() {
        return allowedConnections;
    }

    public List<AddressCount> getTopBlockedAddresses() {
        return topBlockedAddresses;
    }

    public List<AddressCount> getTopAllowedAddresses() {
        return topAllowedAddresses;
    }

    public List<PortCount> getPortSummary() {
        return portSummary;
    }

    public List<ThreatCount> getThreatSummary() {
        return threatSummary;
    }
}

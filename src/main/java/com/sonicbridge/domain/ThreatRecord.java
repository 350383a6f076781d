package com.sonicbridge.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A threat detection reported by the appliance's security services
 * (gateway anti-virus, intrusion prevention, anti-spyware).
 */
public final class ThreatRecord {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    @JsonProperty("severity")
    private final ThreatSeverity severity;

    @JsonProperty("type")
    private final ThreatType type;

    @JsonProperty("source_address")
    private final String sourceAddress;

    @JsonProperty("dest_address")
    private final String destAddress;

    @JsonProperty("description")
    private final String description;

    @JsonProperty("action")
    private final String action;

    @JsonProperty("blocked")
    private final boolean blocked;

    /**
     * Full constructor
     */
    public ThreatRecord(String id, Instant timestamp, ThreatSeverity severity, ThreatType type,
                        String sourceAddress, String destAddress, String description,
                        String action, boolean blocked) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.severity = severity != null ? severity : ThreatSeverity.LOW;
        this.type = type != null ? type : ThreatType.SUSPICIOUS;
        this.sourceAddress = sourceAddress != null ? sourceAddress : CanonicalEvent.UNKNOWN_ADDRESS;
        this.destAddress = destAddress != null ? destAddress : CanonicalEvent.UNKNOWN_ADDRESS;
        this.description = description != null ? description : "Unknown threat";
        this.action = action != null ? action : "blocked";
        this.blocked = blocked;
    }

    public String getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public ThreatSeverity getSeverity() {
        return severity;
    }

    public ThreatType getType() {
        return type;
    }

    public String getSourceAddress() {
        return sourceAddress;
    }

    public String getDestAddress() {
        return destAddress;
    }

    public String getDescription() {
        return description;
    }

    public String getAction() {
        return action;
    }

    public boolean isBlocked() {
        return blocked;
    }
}

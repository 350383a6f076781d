package com.sonicbridge.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sonicbridge.normalization.FieldNormalizer;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Canonical representation of a single firewall event, independent of the
 * SonicOS dialect or wire format it was read from.
 *
 * Instances are immutable. The original payload is kept verbatim in {@link #getRaw()}
 * so every derived field can be audited against the source record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CanonicalEvent {

    public static final String UNKNOWN_ADDRESS = "unknown";
    public static final String NO_RULE = "none";
    public static final String DEFAULT_MESSAGE = "Unparsed log entry";

    @JsonProperty("id")
    private final String id;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    @JsonProperty("severity")
    private final Severity severity;

    @JsonProperty("category")
    private final EventCategory category;

    @JsonProperty("action")
    private final EventAction action;

    @JsonProperty("source_address")
    private final String sourceAddress;

    @JsonProperty("source_port")
    private final Integer sourcePort;

    @JsonProperty("dest_address")
    private final String destAddress;

    @JsonProperty("dest_port")
    private final Integer destPort;

    @JsonProperty("protocol")
    private final Protocol protocol;

    @JsonProperty("rule")
    private final String rule;

    @JsonProperty("message")
    private final String message;

    @JsonProperty("raw")
    private final String raw;

    @JsonProperty("parser")
    private final String parser;

    // SonicOS 8.x extension fields
    @JsonProperty("cloud_id")
    private final String cloudId;

    @JsonProperty("tenant_id")
    private final String tenantId;

    @JsonProperty("file_hash")
    private final String fileHash;

    @JsonProperty("threat_name")
    private final String threatName;

    @JsonProperty("analysis_time_ms")
    private final Long analysisTimeMs;

    private CanonicalEvent(Builder builder) {
        this.raw = builder.raw;
        this.id = isBlank(builder.id) ? UUID.randomUUID().toString() : builder.id;
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.severity = builder.severity != null ? builder.severity : Severity.INFO;
        this.category = builder.category != null ? builder.category : EventCategory.SYSTEM;
        this.message = isBlank(builder.message) ? DEFAULT_MESSAGE : builder.message;
        this.action = builder.action != null ? builder.action : FieldNormalizer.actionFromText(this.message);
        this.sourceAddress = isBlank(builder.sourceAddress) ? UNKNOWN_ADDRESS : builder.sourceAddress;
        this.sourcePort = builder.sourcePort;
        this.destAddress = isBlank(builder.destAddress) ? UNKNOWN_ADDRESS : builder.destAddress;
        this.destPort = builder.destPort;
        this.protocol = builder.protocol != null ? builder.protocol : Protocol.OTHER;
        this.rule = isBlank(builder.rule) ? NO_RULE : builder.rule;
        this.parser = builder.parser;
        this.cloudId = builder.cloudId;
        this.tenantId = builder.tenantId;
        this.fileHash = builder.fileHash;
        this.threatName = builder.threatName;
        this.analysisTimeMs = builder.analysisTimeMs;
    }

    /**
     * Starts a builder for an event read from the given raw payload.
     *
     * @param raw the original record, kept verbatim
     * @return a new builder
     */
    public static Builder builder(String raw) {
        return new Builder(raw);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Severity getSeverity() {
        return severity;
    }

    public EventCategory getCategory() {
        return category;
    }

    public EventAction getAction() {
        return action;
    }

    public String getSourceAddress() {
        return sourceAddress;
    }

    public Integer getSourcePort() {
        return sourcePort;
    }

    public String getDestAddress() {
        return destAddress;
    }

    public Integer getDestPort() {
        return destPort;
    }

    public Protocol getProtocol() {
        return protocol;
    }

    public String getRule() {
        return rule;
    }

    public String getMessage() {
        return message;
    }

    public String getRaw() {
        return raw;
    }

    /**
     * Name of the format parser that produced this event.
     */
    public String getParser() {
        return parser;
    }

    public String getCloudId() {
        return cloudId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getFileHash() {
        return fileHash;
    }

    public String getThreatName() {
        return threatName;
    }

    public Long getAnalysisTimeMs() {
        return analysisTimeMs;
    }

    @JsonIgnore
    public boolean involvesPort(int port) {
        return Objects.equals(sourcePort, port) || Objects.equals(destPort, port);
    }

    @Override
    public String toString() {
        return "CanonicalEvent{id=" + id + ", timestamp=" + timestamp + ", severity=" + severity
            + ", category=" + category + ", action=" + action + ", source=" + sourceAddress
            + ", dest=" + destAddress + ", parser=" + parser + "}";
    }

    /**
     * Builder for {@link CanonicalEvent}. Unset fields receive the canonical defaults on
     * {@link #build()}: generated id, info severity, system category, an action derived
     * from the message (deny when nothing matches), and the unknown address sentinel.
     */
    public static final class Builder {

        private final String raw;
        private String id;
        private Instant timestamp;
        private Severity severity;
        private EventCategory category;
        private EventAction action;
        private String sourceAddress;
        private Integer sourcePort;
        private String destAddress;
        private Integer destPort;
        private Protocol protocol;
        private String rule;
        private String message;
        private String parser;
        private String cloudId;
        private String tenantId;
        private String fileHash;
        private String threatName;
        private Long analysisTimeMs;

        private Builder(String raw) {
            this.raw = Objects.requireNonNull(raw, "raw payload must not be null");
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder category(EventCategory category) {
            this.category = category;
            return this;
        }

        public Builder action(EventAction action) {
            this.action = action;
            return this;
        }

        public Builder sourceAddress(String sourceAddress) {
            this.sourceAddress = sourceAddress;
            return this;
        }

        public Builder sourcePort(Integer sourcePort) {
            this.sourcePort = sourcePort;
            return this;
        }

        public Builder destAddress(String destAddress) {
            this.destAddress = destAddress;
            return this;
        }

        public Builder destPort(Integer destPort) {
            this.destPort = destPort;
            return this;
        }

        public Builder protocol(Protocol protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder rule(String rule) {
            this.rule = rule;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder parser(String parser) {
            this.parser = parser;
            return this;
        }

        public Builder cloudId(String cloudId) {
            this.cloudId = cloudId;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder fileHash(String fileHash) {
            this.fileHash = fileHash;
            return this;
        }

        public Builder threatName(String threatName) {
            this.threatName = threatName;
            return this;
        }

        public Builder analysisTimeMs(Long analysisTimeMs) {
            this.analysisTimeMs = analysisTimeMs;
            return this;
        }

        public CanonicalEvent build() {
            return new CanonicalEvent(this);
        }
    }
}

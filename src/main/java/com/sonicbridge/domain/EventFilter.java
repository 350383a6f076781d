package com.sonicbridge.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Query parameters for event retrieval.
 *
 * The time window, category and limit are sent to the appliance; address, port,
 * action and severity constraints are applied to the normalized events.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class EventFilter {

    public static final int DEFAULT_LIMIT = 100;

    @JsonProperty("start_time")
    private final Instant startTime;

    @JsonProperty("end_time")
    private final Instant endTime;

    @JsonProperty("category")
    private final EventCategory category;

    @JsonProperty("source_address")
    private final String sourceAddress;

    @JsonProperty("dest_address")
    private final String destAddress;

    @JsonProperty("port")
    private final Integer port;

    @JsonProperty("action")
    private final EventAction action;

    @JsonProperty("severities")
    private final Set<Severity> severities;

    @JsonProperty("limit")
    private final int limit;

    @JsonProperty("offset")
    private final int offset;

    private EventFilter(Builder builder) {
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.category = builder.category;
        this.sourceAddress = builder.sourceAddress;
        this.destAddress = builder.destAddress;
        this.port = builder.port;
        this.action = builder.action;
        this.severities = builder.severities.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(builder.severities));
        this.limit = builder.limit;
        this.offset = builder.offset;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks the filter for values that can never describe a valid query.
     *
     * @return this filter, for chaining
     * @throws InvalidFilterException on the first invalid field
     */
    public EventFilter validate() {
        if (startTime != null && endTime != null && endTime.isBefore(startTime)) {
            throw new InvalidFilterException("end_time",
                "End time " + endTime + " is before start time " + startTime);
        }
        if (limit <= 0) {
            throw new InvalidFilterException("limit", "Limit must be positive, got " + limit);
        }
        if (offset < 0) {
            throw new InvalidFilterException("offset", "Offset must not be negative, got " + offset);
        }
        if (port != null && (port < 1 || port > 65535)) {
            throw new InvalidFilterException("port", "Port must be between 1 and 65535, got " + port);
        }
        return this;
    }

    /**
     * True when the event satisfies the address, port, action, category and severity constraints.
     */
    public boolean matches(CanonicalEvent event) {
        if (sourceAddress != null && !sourceAddress.equals(event.getSourceAddress())) {
            return false;
        }
        if (destAddress != null && !destAddress.equals(event.getDestAddress())) {
            return false;
        }
        if (port != null && !event.involvesPort(port)) {
            return false;
        }
        if (action != null && action != event.getAction()) {
            return false;
        }
        if (category != null && category != event.getCategory()) {
            return false;
        }
        return severities.isEmpty() || severities.contains(event.getSeverity());
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public EventCategory getCategory() {
        return category;
    }

    public String getSourceAddress() {
        return sourceAddress;
    }

    public String getDestAddress() {
        return destAddress;
    }

    public Integer getPort() {
        return port;
    }

    public EventAction getAction() {
        return action;
    }

    public Set<Severity> getSeverities() {
        return severities;
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }

    /**
     * Builder for {@link EventFilter}
     */
    public static final class Builder {

        private Instant startTime;
        private Instant endTime;
        private EventCategory category;
        private String sourceAddress;
        private String destAddress;
        private Integer port;
        private EventAction action;
        private final Set<Severity> severities = EnumSet.noneOf(Severity.class);
        private int limit = DEFAULT_LIMIT;
        private int offset;

        private Builder() {
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder category(EventCategory category) {
            this.category = category;
            return this;
        }

        public Builder sourceAddress(String sourceAddress) {
            this.sourceAddress = sourceAddress;
            return this;
        }

        public Builder destAddress(String destAddress) {
            this.destAddress = destAddress;
            return this;
        }

        public Builder port(Integer port) {
            this.port = port;
            return this;
        }

        public Builder action(EventAction action) {
            this.action = action;
            return this;
        }

        public Builder severities(Collection<Severity> severities) {
            this.severities.clear();
            if (severities != null) {
                this.severities.addAll(severities);
            }
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public EventFilter build() {
            return new EventFilter(this);
        }
    }
}

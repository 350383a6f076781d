package com.sonicbridge.normalization.parsers;

import com.sonicbridge.domain.CanonicalEvent;

import java.util.Optional;

/**
 * Interface for recognizing one appliance log format and mapping it to a canonical event.
 * Implementations are stateless and never throw on malformed input.
 */
public interface EventParser {

    /**
     * Parses one log unit if it is in this parser's format
     *
     * @param raw the unit exactly as received; kept verbatim on the resulting event
     * @return the canonical event, or empty when the unit is not in this format
     */
    Optional<CanonicalEvent> parse(String raw);

    /**
     * Returns the format this parser handles
     *
     * @return format identifier (e.g., "structured-syslog", "capture-atp")
     */
    String getFormatName();
}

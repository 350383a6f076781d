package com.sonicbridge.normalization.parsers;

import com.sonicbridge.appliance.DialectVersion;
import com.sonicbridge.normalization.TimestampNormalizer;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of format parsers and the ordered detection chain for each dialect.
 * Chains are resolved once at construction; the first parser that matches a unit wins
 * and the fallback parser closes every chain.
 */
@Component
public class ParserRegistry {

    private final Map<String, EventParser> parsers = new ConcurrentHashMap<>();
    private final Map<DialectVersion, List<EventParser>> chains = new EnumMap<>(DialectVersion.class);
    private final EventParser fallbackParser;

    public ParserRegistry(TimestampNormalizer timestamps) {
        this.fallbackParser = register(new FallbackEventParser(timestamps));

        chains.put(DialectVersion.V7, List.of(
            register(new JsonEventParser(DialectVersion.V7.getFieldMapping(), timestamps)),
            register(new VpnLogParser(timestamps)),
            register(new IpsLogParser(timestamps)),
            register(new StructuredSyslogParser(timestamps)),
            register(MinimalTrafficParser.withEmbeddedTimestamp(timestamps)),
            fallbackParser));

        // JSON field tables and the minimal header differ, so those are per-dialect instances
        chains.put(DialectVersion.V8, List.of(
            new JsonEventParser(DialectVersion.V8.getFieldMapping(), timestamps),
            register(new CaptureAtpLogParser(timestamps)),
            register(new AtpLogParser(timestamps)),
            register(new EnhancedSyslogParser(timestamps)),
            new MinimalTrafficParser(timestamps),
            fallbackParser));
    }

    /**
     * Gets the detection chain for a dialect
     *
     * @param dialect the configured dialect
     * @return parsers in precedence order, fallback last
     */
    public List<EventParser> getChain(DialectVersion dialect) {
        return chains.get(dialect);
    }

    /**
     * Gets a parser by format name
     *
     * @param formatName the format identifier
     * @return the parser, or the fallback parser if the name is unknown
     */
    public EventParser getParser(String formatName) {
        return parsers.getOrDefault(formatName, fallbackParser);
    }

    public EventParser getFallbackParser() {
        return fallbackParser;
    }

    private EventParser register(EventParser parser) {
        parsers.put(parser.getFormatName(), parser);
        return parser;
    }
}

package com.sonicbridge.normalization;

import com.fasterxml.jackson.databind.JsonNode;
import com.sonicbridge.appliance.DialectVersion;
import com.sonicbridge.domain.CanonicalEvent;
import com.sonicbridge.domain.EventAction;
import com.sonicbridge.domain.EventCategory;
import com.sonicbridge.domain.ParsingStats;
import com.sonicbridge.normalization.parsers.EventParser;
import com.sonicbridge.normalization.parsers.FallbackEventParser;
import com.sonicbridge.normalization.parsers.ParserRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Normalization service that turns raw appliance log units into canonical events.
 *
 * Each unit runs through the configured dialect's parser chain; the first matching
 * parser produces the event and the fallback parser guarantees one event per unit.
 */
@Service
public class NormalizationService {

    private static final Logger log = LoggerFactory.getLogger(NormalizationService.class);

    private static final Comparator<CanonicalEvent> NEWEST_FIRST =
        Comparator.comparing(CanonicalEvent::getTimestamp).reversed();

    private final List<EventParser> chain;
    private final DialectVersion dialect;
    private final MeterRegistry meterRegistry;

    // Metrics
    private final Map<String, Counter> parsedCounters = new ConcurrentHashMap<>();
    private final Counter fallbackCounter;

    public NormalizationService(ParserRegistry parserRegistry, DialectVersion dialect, MeterRegistry meterRegistry) {
        this.chain = parserRegistry.getChain(dialect);
        this.dialect = dialect;
        this.meterRegistry = meterRegistry;
        this.fallbackCounter = Counter.builder("sonicbridge.normalization.fallback")
            .description("Number of units that matched no dialect pattern")
            .register(meterRegistry);
    }

    /**
     * Normalize a batch of raw units
     *
     * @param units log lines or serialized records, in any order
     * @return one event per unit, newest first; equal timestamps keep input order
     */
    public List<CanonicalEvent> normalize(List<String> units) {
        List<CanonicalEvent> events = new ArrayList<>(units.size());
        for (String unit : units) {
            events.add(normalizeLine(unit));
        }
        events.sort(NEWEST_FIRST);
        log.debug("Normalized {} units with the SonicOS {} chain", units.size(), dialect.getValue());
        return events;
    }

    /**
     * Normalize a single unit. Never fails; unrecognized input yields a fallback event.
     */
    public CanonicalEvent normalizeLine(String unit) {
        String raw = unit != null ? unit : "";
        for (EventParser parser : chain) {
            Optional<CanonicalEvent> event = parser.parse(raw);
            if (event.isPresent()) {
                recordParsed(parser.getFormatName());
                return event.get();
            }
        }
        throw new IllegalStateException("Parser chain for SonicOS " + dialect.getValue() + " has no fallback");
    }

    /**
     * Normalize structured records. Objects are read from their JSON text; text nodes are
     * treated as log lines.
     */
    public List<CanonicalEvent> normalizeObjects(List<JsonNode> records) {
        List<String> units = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            units.add(record.isTextual() ? record.asText() : record.toString());
        }
        return normalize(units);
    }

    /**
     * Normalize the units and summarize how they were recognized
     */
    public ParsingStats summarize(List<String> units) {
        List<CanonicalEvent> events = normalize(units);
        Map<EventCategory, Long> byCategory = new EnumMap<>(EventCategory.class);
        Map<EventAction, Long> byAction = new EnumMap<>(EventAction.class);
        Map<String, Long> byParser = new TreeMap<>();
        int fallback = 0;

        for (CanonicalEvent event : events) {
            byCategory.merge(event.getCategory(), 1L, Long::sum);
            byAction.merge(event.getAction(), 1L, Long::sum);
            byParser.merge(event.getParser(), 1L, Long::sum);
            if (FallbackEventParser.FORMAT_NAME.equals(event.getParser())) {
                fallback++;
            }
        }
        return new ParsingStats(events.size(), events.size() - fallback, fallback, byCategory, byAction, byParser);
    }

    public DialectVersion getDialect() {
        return dialect;
    }

    private void recordParsed(String formatName) {
        if (FallbackEventParser.FORMAT_NAME.equals(formatName)) {
            fallbackCounter.increment();
            return;
        }
        Counter counter = parsedCounters.computeIfAbsent(formatName, name ->
            Counter.builder("sonicbridge.normalization.parsed")
                .tag("parser", name)
                .description("Number of units recognized by each format parser")
                .register(meterRegistry)
        );
        counter.increment();
    }
}

package com.sonicbridge.normalization.parsers;

import com.sonicbridge.domain.CanonicalEvent;
import com.sonicbridge.normalization.FieldNormalizer;
import com.sonicbridge.normalization.TimestampNormalizer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base class for syslog lines made of a timestamp header followed by
 * {@code key=value} and {@code key="quoted value"} tokens.
 *
 * A line matches when the header pattern matches at the start, the optional tag
 * occurs as a whole word, and every required key is present. Subclasses only map
 * the tokens onto the canonical event.
 */
public abstract class KeyValueSyslogParser implements EventParser {

    /** "Jan 15 10:30:45" */
    protected static final String SYSLOG_TIME = "([A-Za-z]{3}\\s+\\d{1,2}\\s+\\d{2}:\\d{2}:\\d{2})";

    /** "2024-01-15T10:30:45.123Z" */
    protected static final String ISO_TIME =
        "(\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(?:\\.\\d{1,9})?(?:Z|[+-]\\d{2}:?\\d{2})?)";

    private static final Pattern TOKEN = Pattern.compile("(\\w+)=(?:\"([^\"]*)\"|(\\S+))");

    protected final TimestampNormalizer timestamps;
    private final Pattern header;
    private final Pattern tag;
    private final List<String> requiredKeys;

    /**
     * @param header pattern anchored at line start; group 1 must capture the timestamp
     * @param tag    word that must occur in the line, or null
     */
    protected KeyValueSyslogParser(TimestampNormalizer timestamps, Pattern header, String tag,
                                   List<String> requiredKeys) {
        this.timestamps = timestamps;
        this.header = header;
        this.tag = tag != null ? Pattern.compile("\\b" + Pattern.quote(tag) + "\\b") : null;
        this.requiredKeys = List.copyOf(requiredKeys);
    }

    @Override
    public Optional<CanonicalEvent> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String line = raw.trim();
        Matcher headerMatcher = header.matcher(line);
        if (!headerMatcher.lookingAt()) {
            return Optional.empty();
        }
        if ((tag != null && !tag.matcher(line).find()) || !accepts(line)) {
            return Optional.empty();
        }
        Map<String, String> fields = tokenize(line);
        for (String key : requiredKeys) {
            if (!fields.containsKey(key)) {
                return Optional.empty();
            }
        }
        CanonicalEvent.Builder builder = CanonicalEvent.builder(raw).parser(getFormatName());
        extract(builder, headerMatcher.group(1), fields, line);
        return Optional.of(builder.build());
    }

    /**
     * Copies the recognized tokens onto the builder
     *
     * @param headerTimestamp the timestamp captured by the header pattern
     * @param fields          tokens by key; the first occurrence of a key wins
     * @param line            the trimmed line
     */
    protected abstract void extract(CanonicalEvent.Builder builder, String headerTimestamp,
                                    Map<String, String> fields, String line);

    /**
     * Additional match condition checked after the header and tag
     */
    protected boolean accepts(String line) {
        return true;
    }

    /**
     * Key under which a token is stored. Case-sensitive unless overridden.
     */
    protected String normalizeKey(String key) {
        return key;
    }

    private Map<String, String> tokenize(String line) {
        Map<String, String> fields = new LinkedHashMap<>();
        Matcher matcher = TOKEN.matcher(line);
        while (matcher.find()) {
            String value = matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
            fields.putIfAbsent(normalizeKey(matcher.group(1)), value);
        }
        return Collections.unmodifiableMap(fields);
    }

    protected static Integer intValue(Map<String, String> fields, String key) {
        String value = fields.get(key);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Splits an {@code addr[:port[:interface]]} token.
     */
    protected static HostPort hostPort(String value) {
        if (value == null || value.isEmpty()) {
            return new HostPort(null, null);
        }
        String[] parts = value.split(":", 3);
        Integer port = parts.length > 1 ? FieldNormalizer.port(parts[1]).orElse(null) : null;
        return new HostPort(parts[0], port);
    }

    /**
     * Address and optional port of one side of a connection
     */
    protected static final class HostPort {

        private final String address;
        private final Integer port;

        HostPort(String address, Integer port) {
            this.address = address;
            this.port = port;
        }

        public String getAddress() {
            return address;
        }

        public Integer getPort() {
            return port;
        }
    }
}

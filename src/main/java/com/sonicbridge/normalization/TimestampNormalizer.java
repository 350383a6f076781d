package com.sonicbridge.normalization;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Resolves the timestamp encodings seen in appliance logs to an {@link Instant}.
 *
 * Values without a zone are read as UTC. Unparseable or missing values resolve to
 * the ingestion time taken from the injected clock.
 */
@Component
public class TimestampNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TimestampNormalizer.class);

    private static final Pattern EPOCH = Pattern.compile("\\d{9,13}");

    private static final DateTimeFormatter SPACE_SEPARATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /** ISO-8601 with an offset written without a colon, "2024-01-15T10:30:45+0100" */
    private static final DateTimeFormatter COMPACT_OFFSET = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
        .appendOffset("+HHMM", "Z")
        .toFormatter(Locale.ROOT);

    private static final DateTimeFormatter SYSLOG = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern("MMM d HH:mm:ss")
        .toFormatter(Locale.ENGLISH);

    private final Clock clock;

    public TimestampNormalizer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Parse a timestamp, falling back to ingestion time
     *
     * @param value ISO-8601, "yyyy-MM-dd HH:mm:ss", epoch seconds or millis, or syslog "MMM d HH:mm:ss"
     * @return the resolved instant, never null
     */
    public Instant normalize(String value) {
        if (value == null || value.isBlank()) {
            return ingestionTime();
        }
        String text = value.trim();

        if (EPOCH.matcher(text).matches()) {
            long epoch = Long.parseLong(text);
            return text.length() >= 12 ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch);
        }

        Instant parsed = attempt(() -> OffsetDateTime.parse(text).toInstant());
        if (parsed == null) {
            parsed = attempt(() -> OffsetDateTime.parse(text, COMPACT_OFFSET).toInstant());
        }
        if (parsed == null) {
            parsed = attempt(() -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));
        }
        if (parsed == null) {
            parsed = attempt(() -> LocalDateTime.parse(text, SPACE_SEPARATED).toInstant(ZoneOffset.UTC));
        }
        if (parsed == null) {
            parsed = attempt(() -> parseSyslog(text));
        }
        if (parsed == null) {
            log.debug("Unrecognized timestamp '{}', using ingestion time", text);
            return ingestionTime();
        }
        return parsed;
    }

    private Instant parseSyslog(String text) {
        // syslog headers carry no year
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        DateTimeFormatter formatter = new DateTimeFormatterBuilder()
            .append(SYSLOG)
            .parseDefaulting(ChronoField.YEAR, year)
            .toFormatter(Locale.ENGLISH);
        return LocalDateTime.parse(text.replaceAll("\\s+", " "), formatter).toInstant(ZoneOffset.UTC);
    }

    private static Instant attempt(Supplier<Instant> parser) {
        try {
            return parser.get();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public Instant ingestionTime() {
        return clock.instant();
    }
}

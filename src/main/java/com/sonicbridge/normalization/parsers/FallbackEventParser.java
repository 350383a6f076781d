package com.sonicbridge.normalization.parsers;

import com.sonicbridge.domain.CanonicalEvent;
import com.sonicbridge.domain.EventAction;
import com.sonicbridge.normalization.FieldNormalizer;
import com.sonicbridge.normalization.TimestampNormalizer;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last parser in every chain. Accepts any unit and salvages what it can:
 * the first two IPv4 addresses as source and destination and an action keyword.
 * Without a keyword the event is treated as denied.
 */
public class FallbackEventParser implements EventParser {

    public static final String FORMAT_NAME = "fallback";

    static final int MESSAGE_EXCERPT_LENGTH = 100;

    private static final Pattern ACTION = Pattern.compile("\\b(ALLOW|DENY|DROP|RESET|BLOCK)", Pattern.CASE_INSENSITIVE);

    private final TimestampNormalizer timestamps;

    public FallbackEventParser(TimestampNormalizer timestamps) {
        this.timestamps = timestamps;
    }

    @Override
    public Optional<CanonicalEvent> parse(String raw) {
        String unit = raw != null ? raw : "";
        List<String> addresses = FieldNormalizer.ipv4Addresses(unit);

        return Optional.of(CanonicalEvent.builder(unit)
            .parser(FORMAT_NAME)
            .timestamp(timestamps.ingestionTime())
            .sourceAddress(addresses.size() > 0 ? addresses.get(0) : null)
            .destAddress(addresses.size() > 1 ? addresses.get(1) : null)
            .action(action(unit))
            .message(message(unit))
            .build());
    }

    private static EventAction action(String unit) {
        Matcher matcher = ACTION.matcher(unit);
        if (!matcher.find()) {
            return EventAction.DENY;
        }
        String keyword = matcher.group(1).toLowerCase(Locale.ROOT);
        return "block".equals(keyword) ? EventAction.DENY : EventAction.fromValue(keyword);
    }

    static String message(String unit) {
        if (unit.length() <= MESSAGE_EXCERPT_LENGTH) {
            return CanonicalEvent.DEFAULT_MESSAGE + ": " + unit;
        }
        return CanonicalEvent.DEFAULT_MESSAGE + ": " + unit.substring(0, MESSAGE_EXCERPT_LENGTH) + "...";
    }

    @Override
    public String getFormatName() {
        return FORMAT_NAME;
    }
}

package com.sonicbridge.normalization.parsers;

import com.sonicbridge.domain.CanonicalEvent;
import com.sonicbridge.domain.EventAction;
import com.sonicbridge.normalization.FieldNormalizer;
import com.sonicbridge.normalization.TimestampNormalizer;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal traffic line emitted by both generations:
 * {@code <iso time> ... ALLOW|DENY|DROP|RESET ... SRC= DST= PROTO= [SPT=] [DPT=]}.
 * Keywords and keys are matched case-insensitively.
 */
public class MinimalTrafficParser extends KeyValueSyslogParser {

    public static final String FORMAT_NAME = "minimal";

    private static final Pattern HEADER = Pattern.compile("^" + ISO_TIME + "\\s");
    // 7.x relays may put a syslog prefix such as "<134>" before the time
    private static final Pattern EMBEDDED_HEADER = Pattern.compile("^.*?" + ISO_TIME + "\\s");
    private static final Pattern ACTION = Pattern.compile("\\b(ALLOW|DENY|DROP|RESET)\\b", Pattern.CASE_INSENSITIVE);

    public MinimalTrafficParser(TimestampNormalizer timestamps) {
        this(timestamps, HEADER);
    }

    private MinimalTrafficParser(TimestampNormalizer timestamps, Pattern header) {
        super(timestamps, header, null, List.of("SRC", "DST", "PROTO"));
    }

    /**
     * Variant that finds the time anywhere in the line instead of only at its start.
     */
    public static MinimalTrafficParser withEmbeddedTimestamp(TimestampNormalizer timestamps) {
        return new MinimalTrafficParser(timestamps, EMBEDDED_HEADER);
    }

    @Override
    protected boolean accepts(String line) {
        return ACTION.matcher(line).find();
    }

    @Override
    protected void extract(CanonicalEvent.Builder builder, String headerTimestamp, Map<String, String> fields,
                           String line) {
        Matcher actionMatcher = ACTION.matcher(line);
        EventAction action = actionMatcher.find()
            ? EventAction.fromValue(actionMatcher.group(1))
            : EventAction.DENY;
        String source = fields.get("SRC");
        String dest = fields.get("DST");

        builder.timestamp(timestamps.normalize(headerTimestamp))
            .action(action)
            .sourceAddress(source)
            .destAddress(dest)
            .protocol(FieldNormalizer.protocol(fields.get("PROTO")))
            .sourcePort(FieldNormalizer.port(fields.get("SPT")).orElse(null))
            .destPort(FieldNormalizer.port(fields.get("DPT")).orElse(null))
            .message("Traffic " + pastTense(action) + " from " + source + " to " + dest);
    }

    @Override
    protected String normalizeKey(String key) {
        return key.toUpperCase(Locale.ROOT);
    }

    private static String pastTense(EventAction action) {
        return switch (action) {
            case ALLOW -> "allowed";
            case DENY -> "denied";
            case DROP -> "dropped";
            case RESET -> "reset";
        };
    }

    @Override
    public String getFormatName() {
        return FORMAT_NAME;
    }
}

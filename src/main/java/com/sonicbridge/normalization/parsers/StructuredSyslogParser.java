package com.sonicbridge.normalization.parsers;

import com.sonicbridge.domain.CanonicalEvent;
import com.sonicbridge.normalization.FieldNormalizer;
import com.sonicbridge.normalization.TimestampNormalizer;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * SonicOS 7.x standard syslog record:
 * {@code <syslog time> <host> id=<tag> sn=<serial> time="..." fw=<ip> pri=<n> c=<code> m="..." src= dst= proto= rule=}.
 *
 * Severity comes from {@code pri}, category from the numeric {@code c} code, and the
 * action from keywords in the message. The quoted {@code time} field is preferred over
 * the syslog header since it carries the year.
 */
public class StructuredSyslogParser extends KeyValueSyslogParser {

    public static final String FORMAT_NAME = "structured-syslog";

    static final List<String> RECORD_KEYS = List.of("pri", "c", "m", "src", "dst");

    private static final Pattern HEADER = Pattern.compile("^" + SYSLOG_TIME + "\\s+\\S+\\s+id=\\S+\\s+sn=\\S*");

    public StructuredSyslogParser(TimestampNormalizer timestamps) {
        super(timestamps, HEADER, null, RECORD_KEYS);
    }

    protected StructuredSyslogParser(TimestampNormalizer timestamps, Pattern header) {
        super(timestamps, header, null, RECORD_KEYS);
    }

    @Override
    protected void extract(CanonicalEvent.Builder builder, String headerTimestamp, Map<String, String> fields,
                           String line) {
        String time = fields.get("time");
        builder.timestamp(timestamps.normalize(time != null ? time : headerTimestamp));
        extractRecord(builder, fields);
    }

    /**
     * Fields shared by the 7.x and 8.x record layouts
     */
    protected void extractRecord(CanonicalEvent.Builder builder, Map<String, String> fields) {
        HostPort source = hostPort(fields.get("src"));
        HostPort dest = hostPort(fields.get("dst"));
        Integer priority = intValue(fields, "pri");
        Integer categoryCode = intValue(fields, "c");

        builder.severity(priority != null ? FieldNormalizer.severityFromPriority(priority) : null)
            .category(categoryCode != null ? FieldNormalizer.categoryFromCode(categoryCode) : null)
            .message(fields.get("m"))
            .sourceAddress(source.getAddress())
            .sourcePort(source.getPort())
            .destAddress(dest.getAddress())
            .destPort(dest.getPort())
            .protocol(FieldNormalizer.protocol(fields.get("proto")))
            .rule(fields.get("rule"));
    }

    @Override
    public String getFormatName() {
        return FORMAT_NAME;
    }
}

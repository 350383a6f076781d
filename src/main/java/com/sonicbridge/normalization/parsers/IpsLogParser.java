package com.sonicbridge.normalization.parsers;

import com.sonicbridge.domain.CanonicalEvent;
import com.sonicbridge.domain.EventAction;
import com.sonicbridge.domain.EventCategory;
import com.sonicbridge.normalization.FieldNormalizer;
import com.sonicbridge.normalization.TimestampNormalizer;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * SonicOS 7.x intrusion prevention log: {@code <syslog time> ... IPS ... pri= src= dst= sig= msg=""}.
 * IPS detections are always dropped.
 */
public class IpsLogParser extends KeyValueSyslogParser {

    public static final String FORMAT_NAME = "ips";

    private static final Pattern HEADER = Pattern.compile("^" + SYSLOG_TIME + "\\s");

    public IpsLogParser(TimestampNormalizer timestamps) {
        super(timestamps, HEADER, "IPS", List.of("pri", "src", "dst", "sig", "msg"));
    }

    @Override
    protected void extract(CanonicalEvent.Builder builder, String headerTimestamp, Map<String, String> fields,
                           String line) {
        HostPort source = hostPort(fields.get("src"));
        HostPort dest = hostPort(fields.get("dst"));
        Integer priority = intValue(fields, "pri");

        builder.timestamp(timestamps.normalize(headerTimestamp))
            .severity(priority != null ? FieldNormalizer.severityFromPriority(priority) : null)
            .category(EventCategory.IPS)
            .sourceAddress(source.getAddress())
            .sourcePort(source.getPort())
            .destAddress(dest.getAddress())
            .destPort(dest.getPort())
            .protocol(fields.containsKey("proto") ? FieldNormalizer.protocol(fields.get("proto")) : null)
            .message("IPS signature " + fields.get("sig") + ": " + fields.get("msg"))
            .action(EventAction.DROP);
    }

    @Override
    public String getFormatName() {
        return FORMAT_NAME;
    }
}

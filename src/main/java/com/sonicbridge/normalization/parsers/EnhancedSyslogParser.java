package com.sonicbridge.normalization.parsers;

import com.sonicbridge.domain.CanonicalEvent;
import com.sonicbridge.normalization.TimestampNormalizer;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * SonicOS 8.x syslog record. Same layout as the 7.x record behind an ISO-8601 header,
 * optionally followed by the cloud management fields {@code cloud_id} and {@code tenant_id}.
 */
public class EnhancedSyslogParser extends StructuredSyslogParser {

    public static final String FORMAT_NAME = "enhanced-syslog";

    private static final Pattern HEADER = Pattern.compile("^" + ISO_TIME + "\\s+\\S+\\s+id=\\S+\\s+sn=\\S*");

    public EnhancedSyslogParser(TimestampNormalizer timestamps) {
        super(timestamps, HEADER);
    }

    @Override
    protected void extract(CanonicalEvent.Builder builder, String headerTimestamp, Map<String, String> fields,
                           String line) {
        builder.timestamp(timestamps.normalize(headerTimestamp))
            .cloudId(fields.get("cloud_id"))
            .tenantId(fields.get("tenant_id"));
        extractRecord(builder, fields);
    }

    @Override
    public String getFormatName() {
        return FORMAT_NAME;
    }
}

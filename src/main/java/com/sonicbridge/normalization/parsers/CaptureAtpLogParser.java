package com.sonicbridge.normalization.parsers;

import com.sonicbridge.domain.CanonicalEvent;
import com.sonicbridge.domain.EventAction;
import com.sonicbridge.domain.EventCategory;
import com.sonicbridge.domain.Severity;
import com.sonicbridge.normalization.TimestampNormalizer;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * SonicOS 8.x Capture ATP sandbox verdict:
 * {@code <iso time> ... CAPTURE ... analysis_time= file_type= threat_name="" src= dst= disposition=}.
 */
public class CaptureAtpLogParser extends KeyValueSyslogParser {

    public static final String FORMAT_NAME = "capture-atp";

    private static final Pattern HEADER = Pattern.compile("^" + ISO_TIME + "\\s");

    public CaptureAtpLogParser(TimestampNormalizer timestamps) {
        super(timestamps, HEADER, "CAPTURE",
            List.of("analysis_time", "file_type", "threat_name", "src", "dst", "disposition"));
    }

    @Override
    protected void extract(CanonicalEvent.Builder builder, String headerTimestamp, Map<String, String> fields,
                           String line) {
        String disposition = fields.get("disposition");
        String threatName = fields.get("threat_name");
        Integer analysisTime = intValue(fields, "analysis_time");

        builder.timestamp(timestamps.normalize(headerTimestamp))
            .category(EventCategory.ANTIVIRUS)
            .severity("malicious".equalsIgnoreCase(disposition) ? Severity.CRITICAL : Severity.MEDIUM)
            .action("clean".equalsIgnoreCase(disposition) ? EventAction.ALLOW : EventAction.DENY)
            .sourceAddress(hostPort(fields.get("src")).getAddress())
            .destAddress(hostPort(fields.get("dst")).getAddress())
            .threatName(threatName)
            .analysisTimeMs(analysisTime != null ? analysisTime.longValue() : null)
            .message("Capture ATP analysis: " + threatName + " (" + fields.get("file_type") + ") - " + disposition);
    }

    @Override
    public String getFormatName() {
        return FORMAT_NAME;
    }
}

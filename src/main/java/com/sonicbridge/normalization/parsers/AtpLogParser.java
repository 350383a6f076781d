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
 * SonicOS 8.x advanced threat protection log:
 * {@code <iso time> ... ATP ... threat_type= severity= src= dst= [file_hash=] verdict= msg=""}.
 */
public class AtpLogParser extends KeyValueSyslogParser {

    public static final String FORMAT_NAME = "atp";

    private static final Pattern HEADER = Pattern.compile("^" + ISO_TIME + "\\s");
    private static final Pattern HEX = Pattern.compile("[a-fA-F0-9]+");

    public AtpLogParser(TimestampNormalizer timestamps) {
        super(timestamps, HEADER, "ATP", List.of("threat_type", "severity", "src", "dst", "verdict", "msg"));
    }

    @Override
    protected void extract(CanonicalEvent.Builder builder, String headerTimestamp, Map<String, String> fields,
                           String line) {
        String verdict = fields.get("verdict");
        String fileHash = fields.get("file_hash");
        // only an explicit permit allows; a sandbox "clean" verdict is not one
        boolean allowed = "allow".equalsIgnoreCase(verdict);

        builder.timestamp(timestamps.normalize(headerTimestamp))
            .category(EventCategory.ANTIVIRUS)
            .severity(FieldNormalizer.severityFromText(fields.get("severity")))
            .action(allowed ? EventAction.ALLOW : EventAction.DENY)
            .sourceAddress(hostPort(fields.get("src")).getAddress())
            .destAddress(hostPort(fields.get("dst")).getAddress())
            .fileHash(fileHash != null && HEX.matcher(fileHash).matches() ? fileHash : null)
            .message("ATP " + fields.get("threat_type") + " threat: " + fields.get("msg")
                + " (verdict: " + verdict + ")");
    }

    @Override
    public String getFormatName() {
        return FORMAT_NAME;
    }
}

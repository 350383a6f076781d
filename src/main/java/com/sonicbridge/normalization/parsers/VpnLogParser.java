package com.sonicbridge.normalization.parsers;

import com.sonicbridge.domain.CanonicalEvent;
import com.sonicbridge.domain.EventAction;
import com.sonicbridge.domain.EventCategory;
import com.sonicbridge.normalization.TimestampNormalizer;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * SonicOS 7.x VPN session log: {@code <syslog time> ... VPN ... user="" src= dst= result= msg=""}.
 */
public class VpnLogParser extends KeyValueSyslogParser {

    public static final String FORMAT_NAME = "vpn";

    private static final Pattern HEADER = Pattern.compile("^" + SYSLOG_TIME + "\\s");

    public VpnLogParser(TimestampNormalizer timestamps) {
        super(timestamps, HEADER, "VPN", List.of("user", "src", "dst", "result", "msg"));
    }

    @Override
    protected void extract(CanonicalEvent.Builder builder, String headerTimestamp, Map<String, String> fields,
                           String line) {
        String result = fields.get("result");
        builder.timestamp(timestamps.normalize(headerTimestamp))
            .category(EventCategory.VPN)
            .sourceAddress(hostPort(fields.get("src")).getAddress())
            .destAddress(hostPort(fields.get("dst")).getAddress())
            .message("VPN " + result + " for user " + fields.get("user") + ": " + fields.get("msg"))
            .action("success".equalsIgnoreCase(result) ? EventAction.ALLOW : EventAction.DENY);
    }

    @Override
    public String getFormatName() {
        return FORMAT_NAME;
    }
}

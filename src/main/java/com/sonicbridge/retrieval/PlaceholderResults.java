package com.sonicbridge.retrieval;

import com.sonicbridge.domain.CanonicalEvent;
import com.sonicbridge.domain.EventAction;
import com.sonicbridge.domain.EventCategory;
import com.sonicbridge.domain.Protocol;
import com.sonicbridge.domain.Severity;
import com.sonicbridge.domain.ThreatRecord;
import com.sonicbridge.domain.ThreatSeverity;
import com.sonicbridge.domain.ThreatType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Sample data returned while the appliance is unavailable.
 *
 * Every record is labeled so it cannot be mistaken for appliance data: ids start
 * with {@value #ID_PREFIX}, the rule is {@value #RULE} and messages start with
 * {@value #MESSAGE_PREFIX}.
 */
public class PlaceholderResults {

    public static final String ID_PREFIX = "placeholder-";
    public static final String RULE = "placeholder";
    public static final String MESSAGE_PREFIX = "[placeholder] ";

    private final Clock clock;

    public PlaceholderResults(Clock clock) {
        this.clock = clock;
    }

    public List<CanonicalEvent> events() {
        Instant now = clock.instant();
        CanonicalEvent blockedDns = CanonicalEvent.builder("placeholder sample 1")
            .id(ID_PREFIX + "log1")
            .timestamp(now.minus(Duration.ofHours(1)))
            .severity(Severity.HIGH)
            .category(EventCategory.FIREWALL)
            .action(EventAction.DENY)
            .sourceAddress("192.168.1.100")
            .sourcePort(54321)
            .destAddress("8.8.8.8")
            .destPort(53)
            .protocol(Protocol.UDP)
            .rule(RULE)
            .message(MESSAGE_PREFIX + "Connection blocked by firewall rule")
            .parser(RULE)
            .build();
        CanonicalEvent droppedSsh = CanonicalEvent.builder("placeholder sample 2")
            .id(ID_PREFIX + "log2")
            .timestamp(now.minus(Duration.ofMinutes(30)))
            .severity(Severity.MEDIUM)
            .category(EventCategory.IPS)
            .action(EventAction.DROP)
            .sourceAddress("203.0.113.10")
            .sourcePort(80)
            .destAddress("192.168.1.50")
            .destPort(22)
            .protocol(Protocol.TCP)
            .rule(RULE)
            .message(MESSAGE_PREFIX + "Potential SSH brute force attack detected")
            .parser(RULE)
            .build();
        // newest first, like normalized batches
        return List.of(droppedSsh, blockedDns);
    }

    public List<ThreatRecord> threats() {
        Instant now = clock.instant();
        return List.of(
            new ThreatRecord(ID_PREFIX + "threat1", now.minus(Duration.ofMinutes(15)), ThreatSeverity.CRITICAL,
                ThreatType.MALWARE, "198.51.100.5", "192.168.1.25",
                MESSAGE_PREFIX + "Trojan.Win32.Generic detected in network traffic", "quarantined", true),
            new ThreatRecord(ID_PREFIX + "threat2", now.minus(Duration.ofMinutes(10)), ThreatSeverity.HIGH,
                ThreatType.INTRUSION, "203.0.113.20", "192.168.1.10",
                MESSAGE_PREFIX + "SQL injection attempt detected", "blocked", true));
    }
}

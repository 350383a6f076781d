package com.sonicbridge.normalization;

import com.google.common.net.InetAddresses;
import com.sonicbridge.domain.EventAction;
import com.sonicbridge.domain.EventCategory;
import com.sonicbridge.domain.Protocol;
import com.sonicbridge.domain.Severity;
import com.sonicbridge.domain.ThreatSeverity;
import com.sonicbridge.domain.ThreatType;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps the appliance's field encodings (numeric priorities, category codes,
 * action keywords, protocol names) onto the canonical vocabularies.
 *
 * All methods are pure and total: unrecognized input maps to a documented default.
 */
public final class FieldNormalizer {

    private static final Pattern IPV4_CANDIDATE = Pattern.compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b");
    private static final Pattern NUMERIC = Pattern.compile("-?\\d+");

    private static final Pattern ALLOW_WORDS = Pattern.compile("\\b(?:allow(?:ed)?|permit(?:ted)?|accept(?:ed)?)\\b");
    private static final Pattern DENY_WORDS = Pattern.compile("\\b(?:den(?:y|ied)|block(?:ed)?|reject(?:ed)?)\\b");
    private static final Pattern DROP_WORDS = Pattern.compile("\\bdrop(?:ped)?\\b");
    private static final Pattern RESET_WORDS = Pattern.compile("\\breset\\b");

    private FieldNormalizer() {
    }

    /**
     * Syslog-style priority (0 most urgent) to severity.
     */
    public static Severity severityFromPriority(int priority) {
        if (priority < 0) {
            return Severity.INFO;
        }
        if (priority <= 2) {
            return Severity.CRITICAL;
        }
        if (priority <= 4) {
            return Severity.HIGH;
        }
        if (priority <= 6) {
            return Severity.MEDIUM;
        }
        if (priority == 7) {
            return Severity.LOW;
        }
        return Severity.INFO;
    }

    /**
     * Severity keyword or numeric priority text to severity. Unknown text maps to info.
     */
    public static Severity severityFromText(String text) {
        if (text == null || text.isBlank()) {
            return Severity.INFO;
        }
        String value = text.trim().toLowerCase(Locale.ROOT);
        if (NUMERIC.matcher(value).matches()) {
            return severityFromPriority(parseIntSafely(value));
        }
        return switch (value) {
            case "critical", "crit", "emergency", "emerg", "alert" -> Severity.CRITICAL;
            case "high", "error", "err" -> Severity.HIGH;
            case "medium", "med", "warning", "warn" -> Severity.MEDIUM;
            case "low", "notice" -> Severity.LOW;
            default -> Severity.INFO;
        };
    }

    /**
     * Threat severity from keyword or priority text. Threats have no info level; it folds into low.
     */
    public static ThreatSeverity threatSeverity(String text) {
        return switch (severityFromText(text)) {
            case CRITICAL -> ThreatSeverity.CRITICAL;
            case HIGH -> ThreatSeverity.HIGH;
            case MEDIUM -> ThreatSeverity.MEDIUM;
            default -> ThreatSeverity.LOW;
        };
    }

    /**
     * Appliance log category code to category.
     */
    public static EventCategory categoryFromCode(int code) {
        return switch (code) {
            case 1, 256, 257 -> EventCategory.FIREWALL;
            case 2, 512 -> EventCategory.VPN;
            case 3, 768 -> EventCategory.IPS;
            case 4, 1024 -> EventCategory.ANTIVIRUS;
            default -> EventCategory.SYSTEM;
        };
    }

    /**
     * Category name or numeric code text to category.
     */
    public static EventCategory categoryFromText(String text) {
        if (text == null || text.isBlank()) {
            return EventCategory.SYSTEM;
        }
        String value = text.trim().toLowerCase(Locale.ROOT);
        if (NUMERIC.matcher(value).matches()) {
            return categoryFromCode(parseIntSafely(value));
        }
        if (value.contains("firewall") || value.equals("fw")) {
            return EventCategory.FIREWALL;
        }
        if (value.contains("vpn")) {
            return EventCategory.VPN;
        }
        if (value.contains("ips") || value.contains("intrusion")) {
            return EventCategory.IPS;
        }
        if (value.contains("antivirus") || value.equals("av") || value.contains("atp")
            || value.contains("anti-virus")) {
            return EventCategory.ANTIVIRUS;
        }
        return EventCategory.SYSTEM;
    }

    /**
     * Keyword scan for the applied action. Nothing recognizable means deny.
     */
    public static EventAction actionFromText(String text) {
        if (text == null || text.isBlank()) {
            return EventAction.DENY;
        }
        String value = text.toLowerCase(Locale.ROOT);
        if (ALLOW_WORDS.matcher(value).find()) {
            return EventAction.ALLOW;
        }
        if (DENY_WORDS.matcher(value).find()) {
            return EventAction.DENY;
        }
        if (DROP_WORDS.matcher(value).find()) {
            return EventAction.DROP;
        }
        if (RESET_WORDS.matcher(value).find()) {
            return EventAction.RESET;
        }
        return EventAction.DENY;
    }

    /**
     * Protocol name or IANA number; a service suffix such as "tcp/https" is ignored.
     */
    public static Protocol protocol(String text) {
        if (text == null) {
            return Protocol.OTHER;
        }
        String name = text.trim();
        int slash = name.indexOf('/');
        if (slash >= 0) {
            name = name.substring(0, slash);
        }
        return switch (name.toUpperCase(Locale.ROOT)) {
            case "TCP", "6" -> Protocol.TCP;
            case "UDP", "17" -> Protocol.UDP;
            case "ICMP", "1" -> Protocol.ICMP;
            default -> Protocol.OTHER;
        };
    }

    /**
     * Port from a number or numeric string; absent when missing or outside 0..65535.
     */
    public static Optional<Integer> port(Object value) {
        long candidate;
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            candidate = ((Number) value).longValue();
        } else if (value instanceof BigInteger) {
            BigInteger big = (BigInteger) value;
            if (big.bitLength() > 31) {
                return Optional.empty();
            }
            candidate = big.longValue();
        } else if (value instanceof Number) {
            // range check on the double before narrowing, longValue() wraps for BigDecimal
            double number = ((Number) value).doubleValue();
            if (number != Math.floor(number) || number < 0 || number > 65535) {
                return Optional.empty();
            }
            candidate = (long) number;
        } else if (value instanceof String) {
            String text = ((String) value).trim();
            if (!NUMERIC.matcher(text).matches() || text.length() > 6) {
                return Optional.empty();
            }
            candidate = Long.parseLong(text);
        } else {
            return Optional.empty();
        }
        return candidate >= 0 && candidate <= 65535 ? Optional.of((int) candidate) : Optional.empty();
    }

    public static ThreatType threatType(String text) {
        if (text == null) {
            return ThreatType.SUSPICIOUS;
        }
        String value = text.toLowerCase(Locale.ROOT);
        if (value.contains("malware") || value.contains("virus")) {
            return ThreatType.MALWARE;
        }
        if (value.contains("intrusion") || value.contains("ips")) {
            return ThreatType.INTRUSION;
        }
        if (value.contains("botnet") || value.contains("bot")) {
            return ThreatType.BOTNET;
        }
        if (value.contains("spam")) {
            return ThreatType.SPAM;
        }
        return ThreatType.SUSPICIOUS;
    }

    /**
     * Every valid dotted-quad IPv4 address in the text, in order of appearance.
     */
    public static List<String> ipv4Addresses(String text) {
        List<String> addresses = new ArrayList<>();
        if (text == null) {
            return addresses;
        }
        Matcher matcher = IPV4_CANDIDATE.matcher(text);
        while (matcher.find()) {
            String candidate = matcher.group();
            if (InetAddresses.isInetAddress(candidate)) {
                addresses.add(candidate);
            }
        }
        return addresses;
    }

    private static int parseIntSafely(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}

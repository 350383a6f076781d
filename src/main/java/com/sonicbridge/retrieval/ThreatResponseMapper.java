package com.sonicbridge.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.sonicbridge.appliance.ApiEndpoint;
import com.sonicbridge.appliance.MalformedResponseException;
import com.sonicbridge.domain.ThreatRecord;
import com.sonicbridge.domain.ThreatSeverity;
import com.sonicbridge.domain.ThreatType;
import com.sonicbridge.normalization.FieldNormalizer;
import com.sonicbridge.normalization.TimestampNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Maps the security-services response shapes onto {@link ThreatRecord}s.
 *
 * Recognized shapes, in precedence order: a {@code threats} array, a
 * {@code security_services} object with per-service detection lists, and a
 * {@code statistics.intrusion_attempts} array.
 */
public class ThreatResponseMapper {

    static final Comparator<ThreatRecord> MOST_SEVERE_FIRST = Comparator
        .comparing((ThreatRecord threat) -> threat.getSeverity().getRank())
        .thenComparing(ThreatRecord::getTimestamp)
        .reversed();

    private final TimestampNormalizer timestamps;

    public ThreatResponseMapper(TimestampNormalizer timestamps) {
        this.timestamps = timestamps;
    }

    /**
     * @return threats ordered by severity then detection time, most severe and newest first
     * @throws MalformedResponseException when the body has none of the recognized shapes
     */
    public List<ThreatRecord> map(JsonNode body) {
        List<ThreatRecord> threats;
        if (body.path("threats").isArray()) {
            threats = fromThreatList(body.get("threats"));
        } else if (body.path("security_services").isObject()) {
            threats = fromSecurityServices(body.get("security_services"));
        } else if (body.path("statistics").isObject()) {
            threats = fromStatistics(body.get("statistics"));
        } else {
            throw new MalformedResponseException("Unrecognized threat response shape", ApiEndpoint.THREATS);
        }
        threats.sort(MOST_SEVERE_FIRST);
        return threats;
    }

    private List<ThreatRecord> fromThreatList(JsonNode list) {
        List<ThreatRecord> threats = new ArrayList<>();
        for (JsonNode threat : list) {
            String action = text(threat, "action", "disposition");
            boolean blocked = !threat.path("blocked").isBoolean() || threat.get("blocked").asBoolean();
            threats.add(new ThreatRecord(
                text(threat, "id", "threat_id"),
                timestamps.normalize(text(threat, "timestamp", "detection_time")),
                FieldNormalizer.threatSeverity(text(threat, "severity", "priority")),
                FieldNormalizer.threatType(text(threat, "type", "threat_type")),
                text(threat, "source_ip", "src_ip"),
                text(threat, "dest_ip", "dst_ip"),
                text(threat, "description", "threat_description"),
                action,
                blocked && !"allow".equalsIgnoreCase(action)));
        }
        return threats;
    }

    private List<ThreatRecord> fromSecurityServices(JsonNode services) {
        List<ThreatRecord> threats = new ArrayList<>();
        for (JsonNode detection : services.path("gateway_antivirus").path("detections")) {
            threats.add(detection(detection, ThreatType.MALWARE, "high",
                text(detection, "source_ip", "client_ip"),
                text(detection, "dest_ip", "server_ip"),
                orDefault(text(detection, "virus_name", "malware_name"), "Malware detected"),
                orDefault(text(detection, "action"), "quarantined")));
        }
        for (JsonNode event : services.path("intrusion_prevention").path("events")) {
            threats.add(detection(event, ThreatType.INTRUSION, "high",
                text(event, "source_ip", "attacker_ip"),
                text(event, "dest_ip", "victim_ip"),
                orDefault(text(event, "signature", "attack_type"), "Intrusion attempt detected"),
                orDefault(text(event, "action"), "blocked")));
        }
        for (JsonNode detection : services.path("anti_spyware").path("detections")) {
            threats.add(detection(detection, ThreatType.SUSPICIOUS, "medium",
                text(detection, "source_ip"),
                text(detection, "dest_ip"),
                orDefault(text(detection, "spyware_name", "threat_name"), "Spyware detected"),
                orDefault(text(detection, "action"), "blocked")));
        }
        return threats;
    }

    private ThreatRecord detection(JsonNode node, ThreatType type, String defaultSeverity, String source,
                                   String dest, String description, String action) {
        boolean blocked = !node.path("blocked").isBoolean() || node.get("blocked").asBoolean();
        return new ThreatRecord(
            null,
            timestamps.normalize(text(node, "timestamp")),
            FieldNormalizer.threatSeverity(orDefault(text(node, "severity"), defaultSeverity)),
            type,
            source,
            dest,
            description,
            action,
            blocked);
    }

    private List<ThreatRecord> fromStatistics(JsonNode statistics) {
        List<ThreatRecord> threats = new ArrayList<>();
        for (JsonNode attempt : statistics.path("intrusion_attempts")) {
            threats.add(new ThreatRecord(
                null,
                timestamps.ingestionTime(),
                ThreatSeverity.HIGH,
                ThreatType.INTRUSION,
                text(attempt, "source_ip"),
                text(attempt, "target_ip"),
                orDefault(text(attempt, "signature"), "Intrusion attempt"),
                "blocked",
                true));
        }
        return threats;
    }

    private static String text(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && value.isValueNode() && !value.isNull() && !value.asText().isEmpty()) {
                return value.asText();
            }
        }
        return null;
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }
}

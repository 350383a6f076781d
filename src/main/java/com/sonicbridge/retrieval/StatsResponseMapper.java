package com.sonicbridge.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.sonicbridge.appliance.ApiEndpoint;
import com.sonicbridge.appliance.MalformedResponseException;
import com.sonicbridge.domain.AddressCount;
import com.sonicbridge.domain.CanonicalEvent;
import com.sonicbridge.domain.EventCategory;
import com.sonicbridge.domain.PortCount;
import com.sonicbridge.domain.SystemStats;
import com.sonicbridge.domain.ThreatCount;
import com.sonicbridge.normalization.FieldNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds {@link SystemStats} from dashboard/statistics payloads, or derives them
 * from normalized events when neither endpoint answers.
 */
public class StatsResponseMapper {

    static final int TOP_N = 10;

    /**
     * Map a dashboard or statistics payload. Each field is read from the first present alias.
     */
    public SystemStats map(JsonNode body, ApiEndpoint endpoint) {
        if (body == null || !body.isObject()) {
            throw new MalformedResponseException("Statistics payload is not an object", endpoint);
        }
        return new SystemStats(
            number(body, "total_connections", "connection_count"),
            number(body, "blocked_connections", "denied_connections"),
            number(body, "allowed_connections", "permitted_connections"),
            addresses(array(body, "top_blocked_ips", "blocked_sources")),
            addresses(array(body, "top_allowed_ips", "active_sources")),
            ports(array(body, "port_summary", "service_summary")),
            threats(array(body, "threat_summary", "security_events")));
    }

    /**
     * Derive statistics from a window of events. Deny and drop count as blocked.
     */
    public SystemStats derive(List<CanonicalEvent> events) {
        long blocked = 0;
        Map<String, Long> blockedSources = new LinkedHashMap<>();
        Map<String, Long> allowedSources = new LinkedHashMap<>();
        Map<String, Long> ports = new LinkedHashMap<>();
        Map<String, Long> threats = new LinkedHashMap<>();

        for (CanonicalEvent event : events) {
            if (event.getAction().isBlocking()) {
                blocked++;
                blockedSources.merge(event.getSourceAddress(), 1L, Long::sum);
            } else {
                allowedSources.merge(event.getSourceAddress(), 1L, Long::sum);
            }
            if (event.getDestPort() != null) {
                ports.merge(event.getDestPort() + "/" + event.getProtocol().getValue(), 1L, Long::sum);
            }
            if (event.getCategory() == EventCategory.IPS || event.getCategory() == EventCategory.ANTIVIRUS) {
                threats.merge(event.getCategory().getValue(), 1L, Long::sum);
            }
        }

        List<PortCount> portSummary = new ArrayList<>();
        for (Map.Entry<String, Long> entry : top(ports)) {
            String[] key = entry.getKey().split("/", 2);
            portSummary.add(new PortCount(Integer.parseInt(key[0]), key[1], entry.getValue()));
        }
        List<ThreatCount> threatSummary = new ArrayList<>();
        for (Map.Entry<String, Long> entry : top(threats)) {
            threatSummary.add(new ThreatCount(entry.getKey(), entry.getValue()));
        }
        return new SystemStats(events.size(), blocked, events.size() - blocked,
            topAddresses(blockedSources), topAddresses(allowedSources), portSummary, threatSummary);
    }

    private static List<AddressCount> topAddresses(Map<String, Long> counts) {
        List<AddressCount> result = new ArrayList<>();
        for (Map.Entry<String, Long> entry : top(counts)) {
            result.add(new AddressCount(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    // count descending; ties keep first-seen order
    private static List<Map.Entry<String, Long>> top(Map<String, Long> counts) {
        List<Map.Entry<String, Long>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()));
        return entries.subList(0, Math.min(TOP_N, entries.size()));
    }

    private static List<AddressCount> addresses(JsonNode list) {
        List<AddressCount> result = new ArrayList<>();
        for (JsonNode item : list) {
            String address = text(item, "ip", "address");
            if (address != null) {
                result.add(new AddressCount(address, number(item, "count", "connections")));
            }
        }
        return result;
    }

    private static List<PortCount> ports(JsonNode list) {
        List<PortCount> result = new ArrayList<>();
        for (JsonNode item : list) {
            JsonNode value = item.get("port");
            if (value == null) {
                continue;
            }
            Optional<Integer> port = FieldNormalizer.port(value.isNumber() ? value.numberValue() : value.asText());
            if (port.isEmpty()) {
                continue;
            }
            String protocol = text(item, "protocol");
            result.add(new PortCount(port.get(), protocol != null ? protocol : "TCP",
                number(item, "count", "connections")));
        }
        return result;
    }

    private static List<ThreatCount> threats(JsonNode list) {
        List<ThreatCount> result = new ArrayList<>();
        for (JsonNode item : list) {
            String type = text(item, "type", "category");
            result.add(new ThreatCount(type != null ? type : "unknown", number(item, "count", "detections")));
        }
        return result;
    }

    private static JsonNode array(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && value.isArray()) {
                return value;
            }
        }
        return JsonNodeFactory.instance.arrayNode();
    }

    private static long number(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && value.isNumber()) {
                return value.asLong();
            }
            if (value != null && value.isTextual() && value.asText().matches("\\d{1,18}")) {
                return Long.parseLong(value.asText());
            }
        }
        return 0;
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
}

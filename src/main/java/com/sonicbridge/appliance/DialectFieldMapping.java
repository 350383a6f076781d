package com.sonicbridge.appliance;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Field-name table for structured records of one dialect. Each canonical field maps to
 * the ordered list of JSON keys that may carry it; the first present key wins.
 */
public final class DialectFieldMapping {

    static final DialectFieldMapping SONICOS_7 = new DialectFieldMapping(baseAliases());

    static final DialectFieldMapping SONICOS_8 = new DialectFieldMapping(sonicOs8Aliases());

    private final Map<CanonicalField, List<String>> aliases;

    private DialectFieldMapping(Map<CanonicalField, List<String>> aliases) {
        this.aliases = Collections.unmodifiableMap(aliases);
    }

    /**
     * Keys to try for the given field, in precedence order. Empty when the dialect never emits it.
     */
    public List<String> aliasesFor(CanonicalField field) {
        return aliases.getOrDefault(field, List.of());
    }

    private static Map<CanonicalField, List<String>> baseAliases() {
        Map<CanonicalField, List<String>> map = new EnumMap<>(CanonicalField.class);
        map.put(CanonicalField.ID, List.of("id", "log_id"));
        map.put(CanonicalField.TIMESTAMP, List.of("timestamp", "time"));
        map.put(CanonicalField.SEVERITY, List.of("severity", "priority"));
        map.put(CanonicalField.CATEGORY, List.of("category", "log_type"));
        map.put(CanonicalField.ACTION, List.of("action", "disposition"));
        map.put(CanonicalField.SOURCE_ADDRESS, List.of("source_ip", "src_ip", "srcIP"));
        map.put(CanonicalField.SOURCE_PORT, List.of("source_port", "src_port", "srcPort"));
        map.put(CanonicalField.DEST_ADDRESS, List.of("dest_ip", "dst_ip", "destIP"));
        map.put(CanonicalField.DEST_PORT, List.of("dest_port", "dst_port", "destPort"));
        map.put(CanonicalField.PROTOCOL, List.of("protocol", "proto"));
        map.put(CanonicalField.RULE, List.of("rule", "rule_name", "policy"));
        map.put(CanonicalField.MESSAGE, List.of("message", "description", "event_description"));
        return map;
    }

    private static Map<CanonicalField, List<String>> sonicOs8Aliases() {
        Map<CanonicalField, List<String>> map = baseAliases();
        map.put(CanonicalField.CLOUD_ID, List.of("cloud_id", "cloudId"));
        map.put(CanonicalField.TENANT_ID, List.of("tenant_id", "tenantId"));
        map.put(CanonicalField.FILE_HASH, List.of("file_hash", "fileHash"));
        map.put(CanonicalField.THREAT_NAME, List.of("threat_name", "threatName"));
        map.put(CanonicalField.ANALYSIS_TIME, List.of("analysis_time", "analysisTime"));
        return map;
    }
}

package com.sonicbridge.normalization.parsers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sonicbridge.appliance.CanonicalField;
import com.sonicbridge.appliance.DialectFieldMapping;
import com.sonicbridge.domain.CanonicalEvent;
import com.sonicbridge.normalization.FieldNormalizer;
import com.sonicbridge.normalization.TimestampNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Parser for structured (JSON object) log records.
 *
 * Field names differ between firmware releases, so each canonical field is looked
 * up through the dialect's alias table; the first present, non-empty key wins.
 */
public class JsonEventParser implements EventParser {

    private static final Logger log = LoggerFactory.getLogger(JsonEventParser.class);

    public static final String FORMAT_NAME = "json";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DialectFieldMapping mapping;
    private final TimestampNormalizer timestamps;

    public JsonEventParser(DialectFieldMapping mapping, TimestampNormalizer timestamps) {
        this.mapping = mapping;
        this.timestamps = timestamps;
    }

    @Override
    public Optional<CanonicalEvent> parse(String raw) {
        if (raw == null || !raw.trim().startsWith("{")) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(raw.trim());
        } catch (JsonProcessingException e) {
            log.debug("Unit looks like JSON but does not parse: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }

        JsonNode severity = field(root, CanonicalField.SEVERITY);
        JsonNode action = field(root, CanonicalField.ACTION);
        JsonNode analysisTime = field(root, CanonicalField.ANALYSIS_TIME);

        CanonicalEvent event = CanonicalEvent.builder(raw)
            .parser(FORMAT_NAME)
            .id(text(root, CanonicalField.ID))
            .timestamp(timestamps.normalize(text(root, CanonicalField.TIMESTAMP)))
            .severity(severity == null ? null
                : severity.isNumber()
                    ? FieldNormalizer.severityFromPriority(severity.asInt())
                    : FieldNormalizer.severityFromText(severity.asText()))
            .category(FieldNormalizer.categoryFromText(text(root, CanonicalField.CATEGORY)))
            .action(action != null ? FieldNormalizer.actionFromText(action.asText()) : null)
            .sourceAddress(text(root, CanonicalField.SOURCE_ADDRESS))
            .sourcePort(port(root, CanonicalField.SOURCE_PORT))
            .destAddress(text(root, CanonicalField.DEST_ADDRESS))
            .destPort(port(root, CanonicalField.DEST_PORT))
            .protocol(FieldNormalizer.protocol(text(root, CanonicalField.PROTOCOL)))
            .rule(text(root, CanonicalField.RULE))
            .message(text(root, CanonicalField.MESSAGE))
            .cloudId(text(root, CanonicalField.CLOUD_ID))
            .tenantId(text(root, CanonicalField.TENANT_ID))
            .fileHash(text(root, CanonicalField.FILE_HASH))
            .threatName(text(root, CanonicalField.THREAT_NAME))
            .analysisTimeMs(analysisTime != null && analysisTime.canConvertToLong() ? analysisTime.asLong() : null)
            .build();
        return Optional.of(event);
    }

    private JsonNode field(JsonNode root, CanonicalField canonicalField) {
        for (String key : mapping.aliasesFor(canonicalField)) {
            JsonNode value = root.get(key);
            if (value != null && !value.isNull() && !value.isContainerNode()
                && !(value.isTextual() && value.asText().isEmpty())) {
                return value;
            }
        }
        return null;
    }

    private String text(JsonNode root, CanonicalField canonicalField) {
        JsonNode value = field(root, canonicalField);
        return value != null ? value.asText() : null;
    }

    private Integer port(JsonNode root, CanonicalField canonicalField) {
        JsonNode value = field(root, canonicalField);
        if (value == null) {
            return null;
        }
        Object candidate = value.isNumber() ? value.numberValue() : value.asText();
        return FieldNormalizer.port(candidate).orElse(null);
    }

    @Override
    public String getFormatName() {
        return FORMAT_NAME;
    }
}

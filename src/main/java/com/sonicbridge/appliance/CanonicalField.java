package com.sonicbridge.appliance;

/**
 * Canonical event fields that structured (JSON) records are mapped onto.
 */
public enum CanonicalField {
    ID,
    TIMESTAMP,
    SEVERITY,
    CATEGORY,
    ACTION,
    SOURCE_ADDRESS,
    SOURCE_PORT,
    DEST_ADDRESS,
    DEST_PORT,
    PROTOCOL,
    RULE,
    MESSAGE,
    CLOUD_ID,
    TENANT_ID,
    FILE_HASH,
    THREAT_NAME,
    ANALYSIS_TIME
}

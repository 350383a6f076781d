package com.sonicbridge.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Functional area of the appliance that emitted an event.
 */
public enum EventCategory {

    FIREWALL("firewall"),

    VPN("vpn"),

    IPS("ips"),

    ANTIVIRUS("antivirus"),

    SYSTEM("system");

    private final String value;

    EventCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

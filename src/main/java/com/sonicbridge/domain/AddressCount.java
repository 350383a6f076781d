package com.sonicbridge.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Connection count for a single address.
 */
public final class AddressCount {

    @JsonProperty("address")
    private final String address;

    @JsonProperty("count")
    private final long count;

    public AddressCount(String address, long count) {
        this.address = address;
        this.count = count;
    }

    public String getAddress() {
        return address;
    }

    public long getCount() {
        return count;
    }
}

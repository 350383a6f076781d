package com.sonicbridge.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Connection count for a port/protocol pair.
 */
public final class PortCount {

    @JsonProperty("port")
    private final int port;

    @JsonProperty("protocol")
    private final String protocol;

    @JsonProperty("count")
    private final long count;

    public PortCount(int port, String protocol, long count) {
        this.port = port;
        this.protocol = protocol;
        this.count = count;
    }

    public int getPort() {
        return port;
    }

    public String getProtocol() {
        return protocol;
    }

    public long getCount() {
        return count;
    }
}

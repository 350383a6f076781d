package com.sonicbridge.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a connectivity probe against the appliance.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ConnectivityResult {

    @JsonProperty("success")
    private final boolean success;

    @JsonProperty("message")
    private final String message;

    @JsonProperty("firmware_version")
    private final String firmwareVersion;

    private ConnectivityResult(boolean success, String message, String firmwareVersion) {
        this.success = success;
        this.message = message;
        this.firmwareVersion = firmwareVersion;
    }

    public static ConnectivityResult connected(String firmwareVersion) {
        return new ConnectivityResult(true, "Successfully connected to SonicWall device", firmwareVersion);
    }

    public static ConnectivityResult failed(String reason) {
        return new ConnectivityResult(false, "Connection failed: " + reason, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    public String getFirmwareVersion() {
        return firmwareVersion;
    }
}

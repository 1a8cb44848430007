package com.iot.common.dto.device;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Acknowledgment returned by the device service after an upsert.
 */
public record DeviceUpsertResponse(
    @JsonProperty("message")
    String message,

    @JsonProperty("deviceId")
    String deviceId
) {
    public static DeviceUpsertResponse updated(String deviceId) {
        return new DeviceUpsertResponse("Device updated successfully", deviceId);
    }
}

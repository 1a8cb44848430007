package com.iot.common.dto.device;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code PUT /devices/{deviceId}} on the device service.
 *
 * Example JSON:
 * {
 *   "deviceId": "sensor-001",
 *   "username": "alice"
 * }
 *
 * The path carries the authoritative device id; {@code deviceId} in the body
 * is optional and must match it when present.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeviceRegistrationRequest(
    @JsonProperty("deviceId")
    String deviceId,

    @NotBlank(message = "Username is required")
    @JsonProperty("username")
    String username
) {
    public static DeviceRegistrationRequest of(String deviceId, String username) {
        return new DeviceRegistrationRequest(deviceId, username);
    }
}

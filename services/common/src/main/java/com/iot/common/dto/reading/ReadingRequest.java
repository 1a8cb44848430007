package com.iot.common.dto.reading;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /readings} on the reading service.
 *
 * Example JSON:
 * {
 *   "deviceId": "sensor-001",
 *   "reading": 23.5
 * }
 *
 * The reading service is not idempotent: every accepted request stores a new
 * reading.
 */
public record ReadingRequest(
    @JsonProperty("deviceId")
    String deviceId,

    @JsonProperty("reading")
    double reading
) {
    public static ReadingRequest of(String deviceId, double reading) {
        return new ReadingRequest(deviceId, reading);
    }
}

package com.iot.gateway.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single numeric sensor value. Range checks belong to the reading service.
 */
public record ReadingPayload(
    @JsonProperty("reading")
    double reading
) implements MessagePayload {
}

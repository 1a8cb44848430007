package com.iot.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body format: {@code {"error": {"kind": ..., "field": ..., "detail": ...}}}.
 */
public record GatewayErrorResponse(
    @JsonProperty("error")
    GatewayError error
) {
    public static GatewayErrorResponse of(String kind, String field, String detail) {
        return new GatewayErrorResponse(new GatewayError(kind, field, detail));
    }
}

package com.iot.gateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured error reported to the caller.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GatewayError(
    @JsonProperty("kind")
    String kind,

    @JsonProperty("field")
    String field,

    @JsonProperty("detail")
    String detail
) {}

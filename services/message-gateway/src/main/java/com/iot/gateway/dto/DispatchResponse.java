package com.iot.gateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.iot.gateway.model.DownstreamResponse;
import com.iot.gateway.model.MessageEnvelope;
import com.iot.gateway.model.MessageType;

/**
 * Summary returned to the device after a successful dispatch.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DispatchResponse(
    @JsonProperty("message")
    String message,

    @JsonProperty("deviceId")
    String deviceId,

    @JsonProperty("type")
    MessageType type,

    @JsonProperty("username")
    String username,

    @JsonProperty("reading")
    Double reading,

    @JsonProperty("downstreamStatus")
    int downstreamStatus,

    @JsonProperty("downstream")
    JsonNode downstream
) {
    public static DispatchResponse of(MessageEnvelope envelope, DownstreamResponse response) {
        JsonNode body = response.hasBody() ? response.body() : null;
        return switch (envelope.type()) {
            case REGISTRATION -> new DispatchResponse(
                    "Registration processed successfully",
                    envelope.deviceId(),
                    envelope.type(),
                    envelope.registrationData().username(),
                    null,
                    response.status(),
                    body);
            case READING -> new DispatchResponse(
                    "Reading processed successfully",
                    envelope.deviceId(),
                    envelope.type(),
                    null,
                    envelope.readingData().reading(),
                    response.status(),
                    body);
        };
    }
}

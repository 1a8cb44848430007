package com.iot.gateway.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Associates the sending device with a username.
 */
public record RegistrationPayload(
    @JsonProperty("username")
    String username
) implements MessagePayload {

    public RegistrationPayload {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username must not be blank");
        }
    }
}

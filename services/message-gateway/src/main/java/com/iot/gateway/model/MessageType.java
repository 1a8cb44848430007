package com.iot.gateway.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Message types accepted by the gateway, each bound to the payload shape its
 * {@code data} must have.
 */
public enum MessageType {
    REGISTRATION("registration", RegistrationPayload.class),
    READING("reading", ReadingPayload.class);

    private final String value;
    private final Class<? extends MessagePayload> payloadType;

    MessageType(String value, Class<? extends MessagePayload> payloadType) {
        this.value = value;
        this.payloadType = payloadType;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Class<? extends MessagePayload> getPayloadType() {
        return payloadType;
    }

    @JsonCreator
    public static MessageType fromValue(String value) {
        return find(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown message type: " + value));
    }

    /**
     * Case-sensitive lookup by wire value.
     */
    public static Optional<MessageType> find(String value) {
        for (MessageType type : MessageType.values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

package com.iot.gateway.model;

import java.util.Objects;

/**
 * A validated inbound message.
 *
 * Example JSON:
 * {
 *   "deviceId": "sensor-001",
 *   "type": "registration",
 *   "data": {"username": "alice"}
 * }
 */
public record MessageEnvelope(
    String deviceId,
    MessageType type,
    MessagePayload data
) {
    public MessageEnvelope {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("deviceId must not be blank");
        }
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(data, "data");
        if (!type.getPayloadType().isInstance(data)) {
            throw new IllegalArgumentException(
                    "Payload " + data.getClass().getSimpleName() + " does not match type " + type.getValue());
        }
    }

    public static MessageEnvelope registration(String deviceId, String username) {
        return new MessageEnvelope(deviceId, MessageType.REGISTRATION, new RegistrationPayload(username));
    }

    public static MessageEnvelope reading(String deviceId, double reading) {
        return new MessageEnvelope(deviceId, MessageType.READING, new ReadingPayload(reading));
    }

    public RegistrationPayload registrationData() {
        return payload(MessageType.REGISTRATION, RegistrationPayload.class);
    }

    public ReadingPayload readingData() {
        return payload(MessageType.READING, ReadingPayload.class);
    }

    private <T extends MessagePayload> T payload(MessageType expected, Class<T> payloadClass) {
        if (type != expected) {
            throw new IllegalStateException("Envelope is " + type.getValue() + ", not " + expected.getValue());
        }
        return payloadClass.cast(data);
    }
}

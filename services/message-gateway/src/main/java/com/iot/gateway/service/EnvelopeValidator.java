package com.iot.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.iot.gateway.exception.ValidationException;
import com.iot.gateway.model.MessageEnvelope;
import com.iot.gateway.model.MessagePayload;
import com.iot.gateway.model.MessageType;
import com.iot.gateway.model.ReadingPayload;
import com.iot.gateway.model.RegistrationPayload;
import org.springframework.stereotype.Component;

/**
 * Checks the structure of an inbound message and turns it into a
 * {@link MessageEnvelope}.
 *
 * Fields are checked in order: {@code deviceId}, {@code type}, {@code data},
 * then the payload fields of the declared type. The payload is never looked
 * at for an unknown type. Stateless and free of side effects.
 */
@Component
public class EnvelopeValidator {

    static final String DEVICE_ID = "deviceId";
    static final String TYPE = "type";
    static final String DATA = "data";
    static final String USERNAME = "data.username";
    static final String READING = "data.reading";

    public MessageEnvelope validate(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            throw ValidationException.malformed("envelope", "Message must be a JSON object");
        }

        String deviceId = requireDeviceId(raw.get(DEVICE_ID));
        MessageType type = requireType(raw.get(TYPE));
        JsonNode data = requireData(raw.get(DATA));

        MessagePayload payload = switch (type) {
            case REGISTRATION -> registration(data);
            case READING -> reading(data);
        };
        return new MessageEnvelope(deviceId, type, payload);
    }

    private String requireDeviceId(JsonNode node) {
        if (isAbsent(node)) {
            throw ValidationException.missingField(DEVICE_ID);
        }
        if (!node.isTextual()) {
            throw ValidationException.malformed(DEVICE_ID, "Field 'deviceId' must be a string");
        }
        if (node.asText().isBlank()) {
            throw ValidationException.missingField(DEVICE_ID);
        }
        return node.asText();
    }

    private MessageType requireType(JsonNode node) {
        if (isAbsent(node)) {
            throw ValidationException.missingField(TYPE);
        }
        if (!node.isTextual()) {
            throw ValidationException.unknownType(node.toString());
        }
        return MessageType.find(node.asText())
                .orElseThrow(() -> ValidationException.unknownType(node.asText()));
    }

    private JsonNode requireData(JsonNode node) {
        if (isAbsent(node)) {
            throw ValidationException.missingField(DATA);
        }
        if (!node.isObject()) {
            throw ValidationException.malformed(DATA, "Field 'data' must be a JSON object");
        }
        return node;
    }

    private RegistrationPayload registration(JsonNode data) {
        JsonNode username = data.get("username");
        if (isAbsent(username)) {
            throw ValidationException.missingField(USERNAME);
        }
        if (!username.isTextual() || username.asText().isBlank()) {
            throw ValidationException.malformed(USERNAME, "Registration data must contain a non-empty username");
        }
        return new RegistrationPayload(username.asText());
    }

    private ReadingPayload reading(JsonNode data) {
        JsonNode reading = data.get("reading");
        if (isAbsent(reading)) {
            throw ValidationException.missingField(READING);
        }
        if (!reading.isNumber()) {
            throw ValidationException.malformed(READING, "Reading data must contain a numeric reading value");
        }
        double value = reading.doubleValue();
        if (!Double.isFinite(value)) {
            throw ValidationException.malformed(READING, "Reading value is out of range: " + reading.asText());
        }
        return new ReadingPayload(value);
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }
}

package com.iot.gateway.exception;

import com.iot.gateway.model.DispatchState;

/**
 * The inbound envelope is malformed or uses an unknown type.
 */
public class ValidationException extends DispatchException {

    public enum Kind {
        MISSING_FIELD("MissingField"),
        UNKNOWN_TYPE("UnknownType"),
        MALFORMED_PAYLOAD("MalformedPayload");

        private final String value;

        Kind(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }

    private final Kind errorKind;
    private final String field;

    public ValidationException(Kind errorKind, String field, String message) {
        super(message);
        this.errorKind = errorKind;
        this.field = field;
    }

    public static ValidationException missingField(String field) {
        return new ValidationException(Kind.MISSING_FIELD, field, "Field '" + field + "' is required");
    }

    public static ValidationException unknownType(String value) {
        return new ValidationException(Kind.UNKNOWN_TYPE, "type", "Unsupported message type: " + value);
    }

    public static ValidationException malformed(String field, String message) {
        return new ValidationException(Kind.MALFORMED_PAYLOAD, field, message);
    }

    public Kind getErrorKind() {
        return errorKind;
    }

    @Override
    public String kind() {
        return errorKind.getValue();
    }

    @Override
    public String field() {
        return field;
    }

    @Override
    public DispatchState stage() {
        return DispatchState.VALIDATING;
    }
}

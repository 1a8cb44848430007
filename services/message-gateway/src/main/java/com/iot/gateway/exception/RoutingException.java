package com.iot.gateway.exception;

import com.iot.gateway.model.DispatchState;
import com.iot.gateway.model.MessageType;

/**
 * A valid message type has no downstream service configured.
 */
public class RoutingException extends DispatchException {

    public enum Kind {
        NO_TARGET_CONFIGURED("NoTargetConfigured");

        private final String value;

        Kind(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }

    private final Kind errorKind;
    private final MessageType type;

    public RoutingException(Kind errorKind, MessageType type, String message) {
        super(message);
        this.errorKind = errorKind;
        this.type = type;
    }

    public static RoutingException noTargetConfigured(MessageType type) {
        return new RoutingException(Kind.NO_TARGET_CONFIGURED, type,
                "No downstream service configured for message type: " + type.getValue());
    }

    public Kind getErrorKind() {
        return errorKind;
    }

    public MessageType getType() {
        return type;
    }

    @Override
    public String kind() {
        return errorKind.getValue();
    }

    @Override
    public DispatchState stage() {
        return DispatchState.ROUTING;
    }
}

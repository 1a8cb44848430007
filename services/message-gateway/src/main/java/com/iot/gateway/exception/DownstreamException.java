package com.iot.gateway.exception;

import com.iot.gateway.model.DispatchState;

/**
 * The downstream call failed: no connection, no answer in time, or an answer
 * the gateway cannot accept.
 */
public class DownstreamException extends DispatchException {

    public enum Kind {
        UNREACHABLE("Unreachable"),
        TIMEOUT("Timeout"),
        BAD_RESPONSE("BadResponse");

        private final String value;

        Kind(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }

    private final Kind errorKind;
    private final Integer downstreamStatus;

    public DownstreamException(Kind errorKind, Integer downstreamStatus, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
        this.downstreamStatus = downstreamStatus;
    }

    public static DownstreamException unreachable(String message, Throwable cause) {
        return new DownstreamException(Kind.UNREACHABLE, null, message, cause);
    }

    public static DownstreamException timeout(String message, Throwable cause) {
        return new DownstreamException(Kind.TIMEOUT, null, message, cause);
    }

    public static DownstreamException badResponse(int status, String message) {
        return new DownstreamException(Kind.BAD_RESPONSE, status, message, null);
    }

    public static DownstreamException badResponse(int status, String message, Throwable cause) {
        return new DownstreamException(Kind.BAD_RESPONSE, status, message, cause);
    }

    public Kind getErrorKind() {
        return errorKind;
    }

    /**
     * Status code received from the downstream service, or null if none arrived.
     */
    public Integer getDownstreamStatus() {
        return downstreamStatus;
    }

    @Override
    public String kind() {
        return errorKind.getValue();
    }

    @Override
    public DispatchState stage() {
        return DispatchState.FORWARDING;
    }
}

package com.iot.gateway.exception;

import com.iot.gateway.dto.GatewayError;
import com.iot.gateway.model.DispatchState;

/**
 * Base class for failures that end a dispatch in {@link DispatchState#FAILED}.
 * Each subclass maps to one stage of the dispatch and is reported to the
 * caller as a {@link GatewayError}.
 */
public abstract class DispatchException extends RuntimeException {

    protected DispatchException(String message) {
        super(message);
    }

    protected DispatchException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Error kind as it appears on the wire, e.g. {@code MissingField}.
     */
    public abstract String kind();

    /**
     * Stage that was running when the failure occurred.
     */
    public abstract DispatchState stage();

    /**
     * Offending envelope field, if the failure concerns one.
     */
    public String field() {
        return null;
    }

    public GatewayError toError() {
        return new GatewayError(kind(), field(), getMessage());
    }
}

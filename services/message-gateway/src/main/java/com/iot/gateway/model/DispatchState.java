package com.iot.gateway.model;

/**
 * Stages of handling one inbound message. Any stage may exit to {@link #FAILED}.
 */
public enum DispatchState {
    RECEIVED,
    VALIDATING,
    ROUTING,
    FORWARDING,
    COMPLETED,
    FAILED
}

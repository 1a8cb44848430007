package com.iot.gateway.model;

/**
 * Type-dependent {@code data} of an envelope.
 */
public sealed interface MessagePayload permits RegistrationPayload, ReadingPayload {
}

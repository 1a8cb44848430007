package com.iot.gateway.model;

import java.net.URI;
import java.util.Objects;

/**
 * The downstream service selected for one message type.
 */
public record DownstreamTarget(
    MessageType type,
    URI baseUrl
) {
    public DownstreamTarget {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(baseUrl, "baseUrl");
    }

    public String serviceName() {
        return switch (type) {
            case REGISTRATION -> "device service";
            case READING -> "reading service";
        };
    }
}

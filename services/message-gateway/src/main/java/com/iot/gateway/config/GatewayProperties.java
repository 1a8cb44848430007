package com.iot.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.Map;

/**
 * Gateway settings bound from {@code gateway.*}.
 *
 * @param routes  message type value to downstream base URL; blank means not configured
 * @param timeout upper bound for one downstream call
 */
@ConfigurationProperties(prefix = "gateway")
public record GatewayProperties(
    @DefaultValue Map<String, String> routes,
    @DefaultValue("30s") Duration timeout
) {
    /**
     * Largest timeout the connector accepts as a connect timeout in milliseconds.
     */
    public static final Duration MAX_TIMEOUT = Duration.ofMillis(Integer.MAX_VALUE);

    public GatewayProperties {
        routes = routes == null ? Map.of() : Map.copyOf(routes);
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("gateway.timeout must be positive, got " + timeout);
        }
        if (timeout.compareTo(MAX_TIMEOUT) > 0) {
            throw new IllegalArgumentException("gateway.timeout must not exceed " + MAX_TIMEOUT + ", got " + timeout);
        }
    }
}

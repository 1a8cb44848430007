package com.iot.gateway.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GatewayPropertiesTest {

    @Test
    void shouldRejectZeroTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new GatewayProperties(Map.of(), Duration.ZERO));
    }

    @Test
    void shouldRejectTimeoutAboveConnectorLimit() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> new GatewayProperties(Map.of(), Duration.ofDays(30)));

        assertTrue(error.getMessage().contains("gateway.timeout must not exceed"), error.getMessage());
    }

    @Test
    void shouldBuildClientForLargestTimeout() {
        GatewayProperties properties = new GatewayProperties(Map.of(), GatewayProperties.MAX_TIMEOUT);

        assertDoesNotThrow(() -> WebClientConfig.build(properties.timeout()));
    }

    @Test
    void shouldDefaultRoutesToEmpty() {
        assertEquals(Map.of(), new GatewayProperties(null, Duration.ofSeconds(1)).routes());
    }
}

package com.iot.gateway.service;

import com.iot.gateway.config.RoutingTable;
import com.iot.gateway.exception.RoutingException;
import com.iot.gateway.model.DownstreamTarget;
import com.iot.gateway.model.MessageType;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TypeRouterTest {

    @Test
    void shouldRouteEachTypeToItsService() {
        TypeRouter router = new TypeRouter(RoutingTable.from(Map.of(
                "registration", "http://device-service:8001/",
                "reading", "http://reading-service:8002")));

        DownstreamTarget devices = router.route(MessageType.REGISTRATION);
        DownstreamTarget readings = router.route(MessageType.READING);

        assertEquals(URI.create("http://device-service:8001"), devices.baseUrl());
        assertEquals(MessageType.REGISTRATION, devices.type());
        assertEquals(URI.create("http://reading-service:8002"), readings.baseUrl());
    }

    @Test
    void shouldFailWhenTypeHasNoTarget() {
        TypeRouter router = new TypeRouter(RoutingTable.from(Map.of(
                "registration", "http://device-service:8001",
                "reading", "")));

        RoutingException error = assertThrows(RoutingException.class, () -> router.route(MessageType.READING));

        assertEquals(RoutingException.Kind.NO_TARGET_CONFIGURED, error.getErrorKind());
        assertEquals("NoTargetConfigured", error.kind());
        assertEquals(MessageType.READING, error.getType());
    }

    @Test
    void shouldRouteNothingWithEmptyConfiguration() {
        RoutingTable table = RoutingTable.from(Map.of());

        for (MessageType type : MessageType.values()) {
            assertFalse(table.baseUrl(type).isPresent());
        }
    }

    @Test
    void shouldRejectUnknownTypeInConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> RoutingTable.from(Map.of("telemetry", "http://localhost:9000")));
    }

    @Test
    void shouldRejectRelativeUrlInConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> RoutingTable.from(Map.of("registration", "device-service")));
    }
}

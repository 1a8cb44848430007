package com.iot.gateway;

import com.iot.gateway.support.FakeDownstream;
import com.iot.gateway.support.FakeDownstream.Reply;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs the gateway against an in-process device and reading service.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class MessageGatewayIntegrationTest {

    private static final FakeDownstream downstream = FakeDownstream.start();

    @Autowired
    private WebTestClient webTestClient;

    @DynamicPropertySource
    static void downstreamProperties(DynamicPropertyRegistry registry) {
        registry.add("gateway.routes.registration", downstream::baseUrl);
        registry.add("gateway.routes.reading", downstream::baseUrl);
        registry.add("gateway.timeout", () -> "500ms");
    }

    @AfterAll
    static void stopDownstream() {
        downstream.close();
    }

    @BeforeEach
    void resetDownstream() {
        downstream.reset();
    }

    @Test
    void shouldRegisterDevice() {
        post("""
                {"deviceId": "sensor-001", "type": "registration", "data": {"username": "alice"}}
                """)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Registration processed successfully")
                .jsonPath("$.username").isEqualTo("alice")
                .jsonPath("$.downstreamStatus").isEqualTo(200)
                .jsonPath("$.downstream.deviceId").isEqualTo("sensor-001");

        assertEquals(Map.of("sensor-001", "alice"), downstream.usernames());
        assertEquals(1, downstream.requests().size());
    }

    @Test
    void shouldForwardReading() {
        post("""
                {"deviceId": "sensor-001", "type": "reading", "data": {"reading": 23.5}}
                """)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Reading processed successfully")
                .jsonPath("$.reading").isEqualTo(23.5)
                .jsonPath("$.downstreamStatus").isEqualTo(201);

        assertEquals(1, downstream.readings().size());
        assertEquals(23.5, downstream.readings().get(0).path("reading").asDouble());
    }

    @Test
    void shouldKeepOneMappingForRepeatedRegistration() {
        String message = """
                {"deviceId": "sensor-001", "type": "registration", "data": {"username": "alice"}}
                """;
        post(message).expectStatus().isOk();
        post(message).expectStatus().isOk();

        assertEquals(Map.of("sensor-001", "alice"), downstream.usernames());
    }

    @Test
    void shouldStoreEveryRepeatedReading() {
        String message = """
                {"deviceId": "sensor-001", "type": "reading", "data": {"reading": 23.5}}
                """;
        post(message).expectStatus().isOk();
        post(message).expectStatus().isOk();

        assertEquals(2, downstream.readings().size());
    }

    @Test
    void shouldRejectUnknownTypeWithoutForwarding() {
        post("""
                {"deviceId": "bad123", "type": "invalid", "data": {}}
                """)
                .expectStatus().isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY)
                .expectBody()
                .jsonPath("$.error.kind").isEqualTo("UnknownType")
                .jsonPath("$.error.field").isEqualTo("type");

        assertTrue(downstream.requests().isEmpty());
    }

    @Test
    void shouldRejectMissingDeviceIdWithoutForwarding() {
        post("""
                {"type": "reading", "data": {"reading": 1.0}}
                """)
                .expectStatus().isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY)
                .expectBody()
                .jsonPath("$.error.kind").isEqualTo("MissingField")
                .jsonPath("$.error.field").isEqualTo("deviceId");

        assertTrue(downstream.requests().isEmpty());
    }

    @Test
    void shouldTimeOutSlowDownstream() {
        downstream.delay(Duration.ofSeconds(3));

        long start = System.nanoTime();
        post("""
                {"deviceId": "sensor-001", "type": "registration", "data": {"username": "alice"}}
                """)
                .expectStatus().isEqualTo(HttpStatus.GATEWAY_TIMEOUT)
                .expectBody()
                .jsonPath("$.error.kind").isEqualTo("Timeout");
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        assertTrue(elapsed.compareTo(Duration.ofMillis(2500)) < 0, "took " + elapsed);
    }

    @Test
    void shouldPassThroughDownstreamClientError() {
        downstream.reply(Reply.json(400, "{\"detail\": \"Username is required\"}"));

        post("""
                {"deviceId": "sensor-001", "type": "registration", "data": {"username": "alice"}}
                """)
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.kind").isEqualTo("BadResponse")
                .jsonPath("$.error.detail").value(detail ->
                        assertTrue(detail.toString().contains("Username is required")));
    }

    @Test
    void shouldReportDownstreamServerErrorAsBadGateway() {
        downstream.reply(Reply.json(503, "{\"message\": \"maintenance\"}"));

        post("""
                {"deviceId": "sensor-001", "type": "reading", "data": {"reading": 4}}
                """)
                .expectStatus().isEqualTo(HttpStatus.BAD_GATEWAY)
                .expectBody()
                .jsonPath("$.error.kind").isEqualTo("BadResponse");
    }

    private WebTestClient.ResponseSpec post(String body) {
        return webTestClient.post()
                .uri("/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }
}

package com.iot.gateway.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.iot.gateway.service.DispatchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * REST endpoint for messages sent by IoT devices.
 *
 * Endpoints:
 * - POST /messages - registration or reading envelope
 */
@RestController
@RequestMapping("/messages")
public class MessageController {

    private static final Logger log = LoggerFactory.getLogger(MessageController.class);

    private final DispatchService dispatchService;

    public MessageController(DispatchService dispatchService) {
        this.dispatchService = dispatchService;
    }

    /**
     * The body is taken as a raw JSON tree; envelope validation happens in the
     * dispatch service so every rejection uses the same error format.
     */
    @PostMapping(
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public Mono<ResponseEntity<Object>> handleMessage(@RequestBody JsonNode message) {
        log.debug("Received message: deviceId={}, type={}", message.path("deviceId"), message.path("type"));

        return dispatchService.handle(message)
                .map(result -> ResponseEntity.status(result.status()).body(result.responseBody()));
    }
}

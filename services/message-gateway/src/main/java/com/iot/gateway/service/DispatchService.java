package com.iot.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.iot.gateway.dto.DispatchResponse;
import com.iot.gateway.dto.DispatchResult;
import com.iot.gateway.exception.DispatchException;
import com.iot.gateway.exception.DownstreamException;
import com.iot.gateway.exception.RoutingException;
import com.iot.gateway.exception.ValidationException;
import com.iot.gateway.model.DispatchState;
import com.iot.gateway.model.DownstreamResponse;
import com.iot.gateway.model.DownstreamTarget;
import com.iot.gateway.model.MessageEnvelope;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Handles one inbound message end to end:
 * {@code RECEIVED -> VALIDATING -> ROUTING -> FORWARDING -> COMPLETED},
 * leaving for {@code FAILED} as soon as a stage fails.
 *
 * Every call yields exactly one {@link DispatchResult} and at most one
 * downstream call. Nothing is shared between requests except the meters.
 */
@Service
public class DispatchService {

    private static final Logger log = LoggerFactory.getLogger(DispatchService.class);

    private final EnvelopeValidator validator;
    private final TypeRouter router;
    private final DownstreamClient client;
    private final MeterRegistry meterRegistry;

    // Metrics
    private final Counter messagesReceived;
    private final Counter messagesCompleted;
    private final Timer forwardLatency;

    public DispatchService(
            EnvelopeValidator validator,
            TypeRouter router,
            DownstreamClient client,
            MeterRegistry meterRegistry) {
        this.validator = validator;
        this.router = router;
        this.client = client;
        this.meterRegistry = meterRegistry;

        this.messagesReceived = Counter.builder("gateway.messages.received")
                .description("Number of device messages received")
                .register(meterRegistry);

        this.messagesCompleted = Counter.builder("gateway.messages.completed")
                .description("Number of messages accepted by a downstream service")
                .register(meterRegistry);

        this.forwardLatency = Timer.builder("gateway.forward.latency")
                .description("Time taken by the downstream call")
                .register(meterRegistry);
    }

    public Mono<DispatchResult> handle(JsonNode raw) {
        return Mono.defer(() -> {
                    messagesReceived.increment();
                    transition(null, DispatchState.RECEIVED, DispatchState.VALIDATING);
                    MessageEnvelope envelope = validator.validate(raw);

                    transition(envelope, DispatchState.VALIDATING, DispatchState.ROUTING);
                    DownstreamTarget target = router.route(envelope.type());

                    transition(envelope, DispatchState.ROUTING, DispatchState.FORWARDING);
                    return forward(target, envelope)
                            .map(response -> complete(envelope, target, response));
                })
                .onErrorResume(DispatchException.class, error -> Mono.just(fail(error)));
    }

    private Mono<DownstreamResponse> forward(DownstreamTarget target, MessageEnvelope envelope) {
        return Mono.defer(() -> {
            Timer.Sample sample = Timer.start(meterRegistry);
            return client.forward(target, envelope)
                    .doFinally(signal -> sample.stop(forwardLatency));
        });
    }

    private DispatchResult complete(MessageEnvelope envelope, DownstreamTarget target, DownstreamResponse response) {
        messagesCompleted.increment();
        transition(envelope, DispatchState.FORWARDING, DispatchState.COMPLETED);
        log.info("Dispatched {} from device {} to {} (status {})",
                envelope.type().getValue(), envelope.deviceId(), target.serviceName(), response.status());
        return DispatchResult.completed(DispatchResponse.of(envelope, response));
    }

    private DispatchResult fail(DispatchException error) {
        Counter.builder("gateway.messages.failed")
                .description("Number of messages that failed, by error kind")
                .tag("kind", error.kind())
                .register(meterRegistry)
                .increment();

        HttpStatusCode status = classify(error);
        Integer downstreamStatus = error instanceof DownstreamException downstream
                ? downstream.getDownstreamStatus()
                : null;

        if (error instanceof RoutingException) {
            log.error("Dispatch failed while {}: {}", error.stage(), error.getMessage());
        } else {
            log.warn("Dispatch failed while {} with {}: {}", error.stage(), error.kind(), error.getMessage());
        }
        return DispatchResult.failed(error.stage(), status, downstreamStatus, error.toError());
    }

    /**
     * Status returned to the caller for a failed dispatch.
     */
    static HttpStatusCode classify(DispatchException error) {
        if (error instanceof ValidationException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (error instanceof RoutingException) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (error instanceof DownstreamException downstream) {
            return switch (downstream.getErrorKind()) {
                case UNREACHABLE -> HttpStatus.BAD_GATEWAY;
                case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
                case BAD_RESPONSE -> passThrough(downstream.getDownstreamStatus());
            };
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    // Only 4xx answers are passed through, everything else becomes 502
    private static HttpStatusCode passThrough(Integer downstreamStatus) {
        if (downstreamStatus != null && HttpStatusCode.valueOf(downstreamStatus).is4xxClientError()) {
            return HttpStatusCode.valueOf(downstreamStatus);
        }
        return HttpStatus.BAD_GATEWAY;
    }

    private static void transition(MessageEnvelope envelope, DispatchState from, DispatchState to) {
        if (log.isDebugEnabled()) {
            log.debug("Dispatch {} -> {} (device={})", from, to, envelope == null ? "?" : envelope.deviceId());
        }
    }
}

package com.iot.gateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.iot.common.dto.device.DeviceRegistrationRequest;
import com.iot.common.dto.reading.ReadingRequest;
import com.iot.common.util.JsonUtil;
import com.iot.gateway.config.GatewayProperties;
import com.iot.gateway.exception.DownstreamException;
import com.iot.gateway.model.DownstreamResponse;
import com.iot.gateway.model.DownstreamTarget;
import com.iot.gateway.model.MessageEnvelope;
import io.netty.handler.timeout.ReadTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Performs the single outbound call for a dispatched message.
 *
 * Registrations go to {@code PUT {base}/devices/{deviceId}}, readings to
 * {@code POST {base}/readings}. There is no retry: a failed or slow call is
 * reported as a {@link DownstreamException} and the caller decides what to do.
 */
@Component
@Slf4j
public class DownstreamClient {

    static final String DEVICE_PATH = "/devices/{deviceId}";
    static final String READINGS_PATH = "/readings";

    private static final int MAX_DETAIL_LENGTH = 200;

    private final WebClient downstreamWebClient;
    private final Duration timeout;

    public DownstreamClient(WebClient downstreamWebClient, GatewayProperties properties) {
        this.downstreamWebClient = downstreamWebClient;
        this.timeout = properties.timeout();
    }

    /**
     * Forward the envelope to the target service.
     * Cancelling the returned Mono cancels the in-flight request.
     */
    public Mono<DownstreamResponse> forward(DownstreamTarget target, MessageEnvelope envelope) {
        return Mono.defer(() -> prepare(target, envelope)
                        .accept(MediaType.APPLICATION_JSON)
                        .exchangeToMono(response -> readResponse(target, response)))
                .timeout(timeout)
                .onErrorMap(error -> !(error instanceof DownstreamException), error -> translate(target, error))
                .doOnNext(response -> log.debug("{} answered {} for device {}",
                        target.serviceName(), response.status(), envelope.deviceId()));
    }

    private WebClient.RequestHeadersSpec<?> prepare(DownstreamTarget target, MessageEnvelope envelope) {
        String deviceId = envelope.deviceId();
        return switch (envelope.type()) {
            case REGISTRATION -> downstreamWebClient.put()
                    .uri(target.baseUrl() + DEVICE_PATH, deviceId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(DeviceRegistrationRequest.of(deviceId, envelope.registrationData().username()));
            case READING -> downstreamWebClient.post()
                    .uri(target.baseUrl() + READINGS_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(ReadingRequest.of(deviceId, envelope.readingData().reading()));
        };
    }

    private Mono<DownstreamResponse> readResponse(DownstreamTarget target, ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> {
                    if (!status.is2xxSuccessful()) {
                        return Mono.error(DownstreamException.badResponse(status.value(),
                                target.serviceName() + " answered " + status.value() + errorDetail(body)));
                    }
                    return Mono.just(new DownstreamResponse(status.value(), parseBody(target, status.value(), body)));
                });
    }

    private JsonNode parseBody(DownstreamTarget target, int status, String body) {
        if (body.isBlank()) {
            return null;
        }
        try {
            return JsonUtil.readTree(body);
        } catch (JsonProcessingException e) {
            throw DownstreamException.badResponse(status,
                    target.serviceName() + " answered " + status + " with a malformed body", e);
        }
    }

    private DownstreamException translate(DownstreamTarget target, Throwable error) {
        String service = target.serviceName();
        Throwable rootCause = NestedExceptionUtils.getMostSpecificCause(error);
        if (error instanceof TimeoutException || rootCause instanceof ReadTimeoutException) {
            return DownstreamException.timeout(
                    service + " did not answer within " + timeout.toMillis() + " ms", error);
        }
        if (error instanceof WebClientRequestException) {
            return DownstreamException.unreachable(
                    service + " is unreachable at " + target.baseUrl(), error);
        }
        return DownstreamException.unreachable(service + " call failed: " + error.getMessage(), error);
    }

    /**
     * Pull a human-readable reason out of an error body, preferring the
     * {@code detail} or {@code message} member of a JSON object.
     */
    private String errorDetail(String body) {
        if (body.isBlank()) {
            return "";
        }
        String detail = body;
        try {
            JsonNode json = JsonUtil.readTree(body);
            if (json.hasNonNull("detail") && json.get("detail").isTextual()) {
                detail = json.get("detail").asText();
            } else if (json.hasNonNull("message") && json.get("message").isTextual()) {
                detail = json.get("message").asText();
            }
        } catch (JsonProcessingException e) {
            log.trace("Error body is not JSON, using it verbatim: {}", e.getOriginalMessage());
        }
        if (detail.length() > MAX_DETAIL_LENGTH) {
            detail = detail.substring(0, MAX_DETAIL_LENGTH) + "...";
        }
        return ": " + detail;
    }
}

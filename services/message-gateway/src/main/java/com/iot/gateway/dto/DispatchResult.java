package com.iot.gateway.dto;

import com.iot.gateway.model.DispatchState;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

/**
 * Outcome of one dispatch. Exactly one of {@code body} and {@code error} is set.
 *
 * @param state            {@link DispatchState#COMPLETED} or {@link DispatchState#FAILED}
 * @param failedAt         stage that failed, null on success
 * @param status           status to return to the caller
 * @param downstreamStatus status received from the downstream service, if any
 */
public record DispatchResult(
    DispatchState state,
    DispatchState failedAt,
    HttpStatusCode status,
    Integer downstreamStatus,
    DispatchResponse body,
    GatewayError error
) {
    public static DispatchResult completed(DispatchResponse body) {
        return new DispatchResult(DispatchState.COMPLETED, null, HttpStatus.OK,
                body.downstreamStatus(), body, null);
    }

    public static DispatchResult failed(DispatchState failedAt, HttpStatusCode status,
                                        Integer downstreamStatus, GatewayError error) {
        return new DispatchResult(DispatchState.FAILED, failedAt, status, downstreamStatus, null, error);
    }

    public boolean success() {
        return state == DispatchState.COMPLETED;
    }

    /**
     * Body to send back: the summary on success, the error envelope otherwise.
     */
    public Object responseBody() {
        return success() ? body : new GatewayErrorResponse(error);
    }
}

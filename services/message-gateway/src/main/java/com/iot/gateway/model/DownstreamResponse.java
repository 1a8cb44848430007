package com.iot.gateway.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Successful reply from a downstream service.
 *
 * @param status 2xx status code
 * @param body   parsed JSON body, or null when the service sent none
 */
public record DownstreamResponse(
    int status,
    JsonNode body
) {
    public boolean hasBody() {
        return body != null && !body.isMissingNode() && !body.isNull();
    }
}

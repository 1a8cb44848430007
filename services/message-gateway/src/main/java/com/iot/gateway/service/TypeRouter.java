package com.iot.gateway.service;

import com.iot.gateway.config.RoutingTable;
import com.iot.gateway.exception.RoutingException;
import com.iot.gateway.model.DownstreamTarget;
import com.iot.gateway.model.MessageType;
import org.springframework.stereotype.Component;

/**
 * Selects the downstream service for a message type.
 */
@Component
public class TypeRouter {

    private final RoutingTable routingTable;

    public TypeRouter(RoutingTable routingTable) {
        this.routingTable = routingTable;
    }

    public DownstreamTarget route(MessageType type) {
        return routingTable.baseUrl(type)
                .map(url -> new DownstreamTarget(type, url))
                .orElseThrow(() -> RoutingException.noTargetConfigured(type));
    }
}

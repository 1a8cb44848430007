package com.iot.gateway.config;

import com.iot.gateway.model.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the routing table once from {@link GatewayProperties}.
 */
@Configuration
public class RoutingConfig {

    private static final Logger log = LoggerFactory.getLogger(RoutingConfig.class);

    @Bean
    public RoutingTable routingTable(GatewayProperties properties) {
        RoutingTable table = RoutingTable.from(properties.routes());
        for (MessageType type : MessageType.values()) {
            table.baseUrl(type).ifPresentOrElse(
                    url -> log.info("Routing '{}' messages to {}", type.getValue(), url),
                    () -> log.warn("No downstream configured for '{}' messages", type.getValue()));
        }
        return table;
    }
}

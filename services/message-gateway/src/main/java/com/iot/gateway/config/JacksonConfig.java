package com.iot.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iot.common.util.JsonUtil;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/**
 * Envelopes are read and summaries written with the shared mapper, so the
 * gateway and the device service agree on the JSON they exchange.
 * Device messages are small; anything above {@code gateway.max-message-size}
 * is rejected as an unreadable body.
 */
@Configuration
public class JacksonConfig implements WebFluxConfigurer {

    @Value("${gateway.max-message-size:64KB}")
    private DataSize maxMessageSize;

    @Bean
    @Primary
    public ObjectMapper gatewayObjectMapper() {
        return JsonUtil.getObjectMapper();
    }

    @Override
    public void configureHttpMessageCodecs(ServerCodecConfigurer configurer) {
        ObjectMapper mapper = gatewayObjectMapper();
        configurer.defaultCodecs().maxInMemorySize((int) maxMessageSize.toBytes());
        configurer.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper));
        configurer.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(mapper));
    }
}

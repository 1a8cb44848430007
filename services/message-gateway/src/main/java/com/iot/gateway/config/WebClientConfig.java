package com.iot.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iot.common.util.JsonUtil;
import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * WebClient used for every downstream call. Connect and response timeouts
 * follow {@code gateway.timeout} so a stalled socket cannot outlive the call budget.
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient downstreamWebClient(GatewayProperties properties) {
        return build(properties.timeout());
    }

    public static WebClient build(Duration timeout) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.toIntExact(timeout.toMillis()))
                .responseTimeout(timeout);

        ObjectMapper mapper = JsonUtil.getObjectMapper();
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> {
                    codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper));
                    codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(mapper));
                })
                .build();
    }
}

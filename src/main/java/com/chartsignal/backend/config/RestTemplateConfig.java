package com.chartsignal.backend.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Collections;

/**
 * HTTP client for the Bybit kline endpoint. Timeouts and the User-Agent come
 * from {@link BybitApiConfig}.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, BybitApiConfig bybitApiConfig) {
        return builder
            .setConnectTimeout(Duration.ofSeconds(bybitApiConfig.getConnectTimeoutSeconds()))
            .setReadTimeout(Duration.ofSeconds(bybitApiConfig.getReadTimeoutSeconds()))
            .additionalRequestCustomizers(request -> {
                request.getHeaders().set(HttpHeaders.USER_AGENT, bybitApiConfig.getUserAgent());
                request.getHeaders().setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));
            })
            .build();
    }
}

package com.tokengate.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate moralisRestTemplate(RestTemplateBuilder builder, MoralisConfig config) {
        return builder
                .rootUri(config.getBaseUrl())
                .defaultHeader("X-API-Key", config.getApiKey() != null ? config.getApiKey() : "")
                .defaultHeader("Accept", "application/json")
                .setConnectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(config.getReadTimeoutMs()))
                .build();
    }

    @Bean
    public RestTemplate telegramRestTemplate(RestTemplateBuilder builder, TelegramConfig config) {
        return builder
                .rootUri(config.getApiBaseUrl() + "/bot" + config.getBotToken())
                .setConnectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(config.getReadTimeoutMs()))
                .build();
    }
}

package com.attendpush.infrastructure.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Cliente HTTP hacia la API remota de agregación.
 */
@Configuration
public class RemoteClientConfig {

    @Bean
    public RestTemplate remoteRestTemplate(
            RestTemplateBuilder builder,
            @Value("${sync.remote.connect-timeout-ms:5000}") long connectTimeoutMs,
            @Value("${sync.remote.read-timeout-ms:15000}") long readTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}

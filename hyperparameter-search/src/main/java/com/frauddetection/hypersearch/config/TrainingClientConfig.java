package com.frauddetection.hypersearch.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client for the training service. Training a model can take minutes,
 * so the read timeout is far longer than the connect timeout.
 */
@Configuration
public class TrainingClientConfig {

    @Value("${hypersearch.training.connect-timeout-ms:10000}")
    private long connectTimeoutMs;

    @Value("${hypersearch.training.read-timeout-ms:600000}")
    private long readTimeoutMs;

    @Bean
    @Qualifier("trainingRestTemplate")
    public RestTemplate trainingRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}

package com.realdiscount.pipeline.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, DiscountPipelineProperties properties) {
        DiscountPipelineProperties.Source source = properties.getSource();
        return builder
                .setConnectTimeout(Duration.ofSeconds(source.getConnectTimeoutSeconds()))
                .setReadTimeout(Duration.ofSeconds(source.getReadTimeoutSeconds()))
                .defaultHeader("User-Agent", "real-discount-pipeline/1.0")
                .build();
    }
}

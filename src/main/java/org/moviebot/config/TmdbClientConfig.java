package org.moviebot.config;

import org.moviebot.service.RetryingExecutor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class TmdbClientConfig {

    @Bean
    public RestTemplate tmdbRestTemplate(RestTemplateBuilder builder, TmdbProperties properties) {
        return builder
                .setConnectTimeout(properties.getRequestTimeout())
                .setReadTimeout(properties.getRequestTimeout())
                .build();
    }

    @Bean
    public RetryingExecutor tmdbRetryingExecutor(TmdbProperties properties) {
        return new RetryingExecutor(properties.getRetry().getMaxAttempts(), properties.getRetry().getDelay());
    }
}

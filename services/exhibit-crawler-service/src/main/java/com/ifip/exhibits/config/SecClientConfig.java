package com.ifip.exhibits.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class SecClientConfig {

    @Bean
    @Qualifier("secArchiveWebClient")
    WebClient secArchiveWebClient(CrawlerProperties properties) {
        int maxBytes = Math.max(8, properties.getArchiveMaxInMemoryMb()) * 1024 * 1024;
        ExchangeStrategies strategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxBytes))
            .build();
        return WebClient.builder()
            .defaultHeader("Accept", "*/*")
            .exchangeStrategies(strategies)
            .build();
    }

    @Bean
    RateLimiter secRequestRateLimiter(CrawlerProperties properties) {
        return RateLimiter.create(Math.max(0.1, properties.getRequestsPerSecond()));
    }
}

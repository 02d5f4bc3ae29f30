package com.ifip.exhibits.client;

import com.google.common.util.concurrent.RateLimiter;
import com.ifip.exhibits.config.CrawlerProperties;
import java.net.URI;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

@Component
public class SecArchiveClient implements DocumentFetcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(SecArchiveClient.class);

    private final WebClient secArchiveWebClient;
    private final RateLimiter rateLimiter;
    private final int maxRetries;
    private final Duration retryBackoff;
    private final Duration requestTimeout;
    private final Set<Integer> retryableStatuses;

    public SecArchiveClient(
        @Qualifier("secArchiveWebClient") WebClient secArchiveWebClient,
        RateLimiter rateLimiter,
        CrawlerProperties properties
    ) {
        this.secArchiveWebClient = secArchiveWebClient;
        this.rateLimiter = rateLimiter;
        this.maxRetries = Math.max(0, properties.getMaxRetries());
        this.retryBackoff = Duration.ofMillis(Math.max(1, properties.getRetryBackoffMs()));
        this.requestTimeout = Duration.ofSeconds(Math.max(1, properties.getRequestTimeoutSeconds()));
        this.retryableStatuses = Set.copyOf(properties.getRetryableStatuses());
    }

    @Override
    public FetchResult fetch(String url, String userAgent) {
        try {
            byte[] body = Mono.defer(() -> attempt(url, userAgent))
                .retryWhen(Retry.backoff(maxRetries, retryBackoff)
                    .filter(this::isRetryable)
                    .scheduler(Schedulers.boundedElastic())
                    .doBeforeRetry(signal -> LOGGER.debug("Retrying {} (attempt {}): {}",
                        url, signal.totalRetries() + 2, signal.failure().toString())))
                .block();

            if (body == null) {
                return FetchResult.failure(url, 0, "empty response body");
            }
            return FetchResult.success(url, body);
        } catch (RuntimeException ex) {
            Throwable cause = Exceptions.isRetryExhausted(ex) && ex.getCause() != null ? ex.getCause() : Exceptions.unwrap(ex);
            if (cause instanceof WebClientResponseException responseException && !isRetryable(responseException)) {
                int status = responseException.getStatusCode().value();
                LOGGER.debug("Request for {} answered {}, keeping response body", url, status);
                return FetchResult.completed(url, responseException.getResponseBodyAsByteArray(), status);
            }
            LOGGER.debug("Request for {} failed due to: {}", url, cause.toString());
            return FetchResult.failure(url, statusOf(cause), describe(cause));
        }
    }

    private Mono<byte[]> attempt(String url, String userAgent) {
        rateLimiter.acquire();
        return secArchiveWebClient.get()
            .uri(URI.create(url))
            .header(HttpHeaders.USER_AGENT, userAgent)
            .retrieve()
            .bodyToMono(byte[].class)
            .timeout(requestTimeout);
    }

    boolean isRetryable(Throwable failure) {
        if (failure instanceof WebClientResponseException responseException) {
            return retryableStatuses.contains(responseException.getStatusCode().value());
        }
        return failure instanceof WebClientRequestException || failure instanceof TimeoutException;
    }

    private int statusOf(Throwable failure) {
        if (failure instanceof WebClientResponseException responseException) {
            return responseException.getStatusCode().value();
        }
        return 0;
    }

    private String describe(Throwable failure) {
        String message = failure.getMessage();
        return message == null || message.isBlank() ? failure.getClass().getSimpleName() : message;
    }
}

package com.sonarrmcp.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * A Spring configuration class responsible for creating the HTTP client used to reach the upstream API.
 * This factory is the single place that defines the client's retry policy and default headers.
 */
@Configuration
public class HttpClientFactory {

    private static final int MAX_IN_MEMORY_BYTES = 16 * 1024 * 1024;

    /**
     * Creates the WebClient that talks to the upstream API, with a built-in retry mechanism.
     * <p>
     * Requests answered with HTTP 429 (Too Many Requests) or HTTP 503 (Service Unavailable) are retried with an
     * exponential backoff that starts at the configured delay and doubles for each attempt. Every other status,
     * and every timeout, is handed back to the caller untouched. The API key, if configured, is sent as a
     * default header on every request.
     *
     * @param properties The gateway configuration.
     * @return A fully configured {@link WebClient}.
     */
    @Bean
    public WebClient upstreamWebClient(GatewayProperties properties) {
        GatewayProperties.Upstream upstream = properties.getUpstream();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, upstream.getRetry().getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(upstream.getRetry().getInitialBackoff(), 2))
                .retryOnException(HttpClientFactory::isRetryable)
                .build();

        Retry retry = RetryRegistry.of(config).retry("sonarr-upstream");

        WebClient.Builder builder = WebClient.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .filter((request, next) -> next.exchange(request)
                        .flatMap(HttpClientFactory::failOnRetryableStatus)
                        .transform(RetryOperator.of(retry)));

        if (upstream.getApiKey() != null && !upstream.getApiKey().isBlank()) {
            builder.defaultHeader(upstream.getApiKeyHeader(), upstream.getApiKey());
        }
        return builder.build();
    }

    static boolean isRetryable(Throwable e) {
        return e instanceof WebClientResponseException.ServiceUnavailable
                || e instanceof WebClientResponseException.TooManyRequests;
    }

    private static Mono<ClientResponse> failOnRetryableStatus(ClientResponse response) {
        int status = response.statusCode().value();
        if (status == HttpStatus.SERVICE_UNAVAILABLE.value() || status == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return response.createException().flatMap(e -> Mono.<ClientResponse>error(e));
        }
        return Mono.just(response);
    }
}

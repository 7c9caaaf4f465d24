package com.sonarrmcp.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.sonarrmcp.config.GatewayProperties;
import com.sonarrmcp.exception.UpstreamException;
import com.sonarrmcp.model.UpstreamRequest;
import com.sonarrmcp.model.UpstreamResponse;
import com.sonarrmcp.service.api.UpstreamClient;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import reactor.core.Exceptions;

/**
 * Sends requests through the shared {@link WebClient}. Retries on 429 and 503 happen inside the client (see
 * {@link com.sonarrmcp.config.HttpClientFactory}); this class only turns the final outcome into an
 * {@link UpstreamResponse} or an {@link UpstreamException}.
 */
@Service
@Slf4j
public class WebClientUpstreamClient implements UpstreamClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration timeout;

    public WebClientUpstreamClient(WebClient webClient, ObjectMapper objectMapper, GatewayProperties properties) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.baseUrl = properties.getUpstream().getBaseUrl();
        this.timeout = properties.getUpstream().getTimeout();
    }

    @Override
    public UpstreamResponse execute(UpstreamRequest request) {
        URI uri = buildUri(request);
        log.debug("--> {} {}", request.method(), uri);

        WebClient.RequestBodySpec spec = webClient.method(HttpMethod.valueOf(request.method())).uri(uri);
        if (request.headers() != null) {
            request.headers().forEach(spec::header);
        }
        if (request.body() != null) {
            spec.contentType(MediaType.APPLICATION_JSON).bodyValue(request.body());
        }

        try {
            UpstreamResponse response = spec
                    .exchangeToMono(clientResponse -> clientResponse.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new UpstreamResponse(clientResponse.statusCode().value(), parseBody(body))))
                    .timeout(timeout)
                    .block();
            log.debug("<-- {} {} {}", response.status(), request.method(), uri);
            return response;
        } catch (WebClientResponseException e) {
            // Retries exhausted on a 429 or 503; the status is reported like any other.
            log.debug("<-- {} {} {} (after retries)", e.getStatusCode().value(), request.method(), uri);
            return new UpstreamResponse(e.getStatusCode().value(), parseBody(e.getResponseBodyAsString()));
        } catch (WebClientRequestException e) {
            log.warn("Upstream request {} {} failed: {}", request.method(), uri, e.getMessage());
            throw UpstreamException.transport(request.toolName(), rootMessage(e), e);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                log.warn("Upstream request {} {} timed out after {}", request.method(), uri, timeout);
                throw UpstreamException.timeout(request.toolName(), timeout, e);
            }
            throw UpstreamException.transport(request.toolName(), rootMessage(e), e);
        }
    }

    private URI buildUri(UpstreamRequest request) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl).path(request.path());
        if (request.query() != null) {
            for (Map.Entry<String, List<String>> entry : request.query().entrySet()) {
                // Everything outside the unreserved set is escaped; a bare '+' would reach the upstream as a space.
                String key = UriUtils.encode(entry.getKey(), StandardCharsets.UTF_8);
                for (String value : entry.getValue()) {
                    builder.queryParam(key, UriUtils.encode(value, StandardCharsets.UTF_8));
                }
            }
        }
        return builder.build(true).toUri();
    }

    private JsonNode parseBody(String body) {
        if (body == null || body.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Upstream body is not JSON; returning it as text.");
            return TextNode.valueOf(body);
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}

package com.sonarrmcp.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Strongly-typed configuration of the gateway.
 *
 * Expected configuration shape (application.yml):
 *
 * mcp:
 *   openapi-location: ${SONARR_OPENAPI_LOCATION}
 *   upstream:
 *     base-url: ${SONARR_URL}
 *     api-key: ${SONARR_API_KEY}       # may be ENC(...), see the encrypt-key command
 *     timeout: 30s
 *   discovery:
 *     default-max-results: 10
 *     max-results-ceiling: 50
 *   core-tools:
 *     names: [get_series_lookup, get_series]
 *   simplification:
 *     defaults:
 *       drop-paths: ["$..images"]
 *     categories:
 *       series:
 *         max-string-length: 200
 *
 * Note: the API key is sensitive and must not be logged.
 */
@Data
@Component
@ConfigurationProperties(prefix = "mcp")
public class GatewayProperties {

    /**
     * File path or URL of the OpenAPI document the catalog is built from.
     */
    private String openapiLocation;

    private Upstream upstream = new Upstream();

    private Discovery discovery = new Discovery();

    private Catalog catalog = new Catalog();

    private CoreTools coreTools = new CoreTools();

    private Simplification simplification = new Simplification();

    /**
     * Connection settings of the wrapped API.
     */
    @Data
    public static class Upstream {
        private String baseUrl = "http://localhost:8989";
        private String apiKey;
        private String apiKeyHeader = "X-Api-Key";
        private Duration timeout = Duration.ofSeconds(30);
        private RetrySettings retry = new RetrySettings();
    }

    /**
     * Retries of the HTTP client on 429 and 503 answers. Timeouts are never retried.
     */
    @Data
    public static class RetrySettings {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
    }

    @Data
    public static class Discovery {
        private int defaultMaxResults = 10;
        /**
         * Hard upper bound; larger requests are clamped to it.
         */
        private int maxResultsCeiling = 50;
    }

    @Data
    public static class Catalog {
        /**
         * How many nested schema references are expanded before a "schema truncated" marker is used.
         */
        private int maxSchemaDepth = 8;
        /**
         * Leading path segments that never name a category. Version segments (v1, v3, ...) are always skipped.
         */
        private List<String> ignoredPathPrefixes = new ArrayList<>(List.of("api"));
    }

    @Data
    public static class CoreTools {
        /**
         * High-frequency tools shown before any discovery call, after the meta-tools.
         */
        private List<String> names = new ArrayList<>();
        private int maxSize = 8;
    }

    @Data
    public static class Simplification {
        /**
         * Applied to every tool.
         */
        private Policy defaults = new Policy();
        /**
         * Applied to tools carrying the category tag used as key.
         */
        private Map<String, Policy> categories = new LinkedHashMap<>();
    }

    @Data
    public static class Policy {
        /**
         * JsonPath expressions removed from upstream payloads.
         */
        private List<String> dropPaths = new ArrayList<>();
        /**
         * Text values longer than this are cut; 0 disables truncation.
         */
        private int maxStringLength;
    }
}

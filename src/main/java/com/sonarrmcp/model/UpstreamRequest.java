package com.sonarrmcp.model;

import java.util.List;
import java.util.Map;

/**
 * The request shape handed to the upstream HTTP client once an invocation has been validated and marshaled.
 *
 * @param toolName The tool the request was built for; used in error messages.
 * @param method   The HTTP method in upper case.
 * @param path     The path with every placeholder substituted and percent-encoded.
 * @param query    Query parameters; a key may repeat.
 * @param headers  Extra request headers.
 * @param body     The JSON body, or {@code null} for none.
 */
public record UpstreamRequest(String toolName, String method, String path, Map<String, List<String>> query,
                              Map<String, String> headers, Object body) {
}

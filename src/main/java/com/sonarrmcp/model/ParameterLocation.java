package com.sonarrmcp.model;

import java.util.Locale;

/**
 * Where the value of a {@link ToolParameter} travels when a tool is dispatched.
 */
public enum ParameterLocation {
    PATH,
    QUERY,
    HEADER,
    BODY,
    /**
     * Consumed by the gateway itself. Only the hand-authored meta-tools use it; it never reaches the upstream API.
     */
    ARGUMENT;

    /**
     * Maps an OpenAPI {@code in} value ("path", "query", "header") onto a location.
     *
     * @param in The OpenAPI parameter location.
     * @return The matching location, or {@code null} for locations the gateway does not expose (e.g. "cookie").
     */
    public static ParameterLocation fromOpenApi(String in) {
        if (in == null) {
            return null;
        }
        return switch (in.toLowerCase(Locale.ROOT)) {
            case "path" -> PATH;
            case "query" -> QUERY;
            case "header" -> HEADER;
            default -> null;
        };
    }
}

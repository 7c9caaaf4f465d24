package com.sonarrmcp.model;

/**
 * A request to the discovery engine. Every component is optional.
 *
 * @param category   A category tag to filter on (case-insensitive), or {@code null}.
 * @param keyword    Free text matched against tool names, tags, summaries and parameter names, or {@code null}.
 * @param maxResults The requested number of results, or {@code null} for the server default.
 */
public record DiscoveryQuery(String category, String keyword, Integer maxResults) {

    public static DiscoveryQuery unfiltered() {
        return new DiscoveryQuery(null, null, null);
    }

    public static DiscoveryQuery byCategory(String category) {
        return new DiscoveryQuery(category, null, null);
    }

    public static DiscoveryQuery byKeyword(String keyword) {
        return new DiscoveryQuery(null, keyword, null);
    }

    public boolean hasCategory() {
        return category != null && !category.isBlank();
    }

    public boolean hasKeyword() {
        return keyword != null && !keyword.isBlank();
    }

    /**
     * @return {@code true} when neither a filter nor a limit was given, which asks for the core tool set only.
     */
    public boolean isUnfiltered() {
        return !hasCategory() && !hasKeyword() && maxResults == null;
    }
}

package com.sonarrmcp.model;

import java.util.SortedSet;

/**
 * One lightweight entry of a {@link DiscoveryResult}. Parameter schemas are deliberately absent; they are
 * fetched with a separate schema request.
 *
 * @param name       The tool name.
 * @param summary    The tool summary.
 * @param tags       The tool's category tags.
 * @param matchScore The keyword score, {@code 0} when no keyword was given.
 */
public record DiscoveryMatch(String name, String summary, SortedSet<String> tags, int matchScore) {

    public static DiscoveryMatch of(ToolDescriptor tool, int matchScore) {
        return new DiscoveryMatch(tool.getName(), tool.getSummary(), tool.getTags(), matchScore);
    }
}

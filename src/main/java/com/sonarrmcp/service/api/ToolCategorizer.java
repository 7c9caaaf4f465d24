package com.sonarrmcp.service.api;

import java.util.Collection;
import java.util.List;
import java.util.SortedSet;

/**
 * Derives the category tags of a tool. Implementations must be pure: the same input always yields the same tags.
 */
public interface ToolCategorizer {

    /**
     * @param method       The HTTP method of the operation.
     * @param path         The path template of the operation.
     * @param declaredTags The tags declared in the document; may be {@code null}.
     * @return A non-empty set of normalized tags.
     */
    SortedSet<String> tag(String method, String path, Collection<String> declaredTags);

    /**
     * Normalizes a tag or category label the same way {@link #tag} does, so lookups are case-insensitive.
     */
    String normalize(String label);

    /**
     * Splits a path template into segments, dropping the empty ones and the leading API prefix and version segments.
     * Placeholders are kept.
     */
    List<String> meaningfulSegments(String path);
}

package com.sonarrmcp.model;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import lombok.Builder;
import lombok.Value;

/**
 * A callable tool, i.e. a single upstream API operation (e.g., a GET request to /api/v3/series/{id}).
 * This class captures everything an agent needs to call the operation once it has been discovered.
 * <p>
 * Instances are immutable and are shared by every reader of a {@link CatalogIndex}.
 */
@Value
@Builder(toBuilder = true)
public class ToolDescriptor {

    /**
     * A unique, stable identifier, derived from the {@code operationId} or from the HTTP method and path.
     */
    String name;

    /**
     * A short human-readable description of what the tool does.
     */
    String summary;

    /**
     * The longer operation description, if the document provides one.
     */
    String description;

    /**
     * The upstream HTTP method in upper case (e.g. "GET"). {@code null} for meta-tools.
     */
    String method;

    /**
     * The upstream path template, which may include placeholders (e.g. "/api/v3/series/{id}").
     */
    String path;

    /**
     * The ordered list of arguments the tool accepts.
     *
     * @see ToolParameter
     */
    List<ToolParameter> parameters;

    /**
     * The expanded schema of the request body, or {@code null} if the operation takes no body.
     */
    Map<String, Object> requestBodySchema;

    /**
     * The expanded schema of a successful response, or {@code null} if the document does not describe one.
     */
    Map<String, Object> responseSchema;

    /**
     * The category labels of the tool. Never empty.
     */
    SortedSet<String> tags;

    /**
     * {@code true} when the request body was split into one {@link ParameterLocation#BODY} parameter per
     * property; {@code false} when a single parameter carries the whole body.
     */
    boolean flattenedBody;
}

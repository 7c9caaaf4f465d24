package com.sonarrmcp.model;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Represents a single argument a tool accepts.
 * This class models the details of a parameter, such as its name, location (path, query, body, etc.),
 * and its expanded schema.
 * <p>
 * Lombok's {@code @Value} makes instances immutable so they can be shared by concurrent readers of the catalog.
 */
@Value
@Builder
public class ToolParameter {

    /**
     * The name of the parameter, unique within its {@link ToolDescriptor}.
     */
    String name;

    /**
     * Where the value is placed on the upstream request.
     */
    ParameterLocation location;

    /**
     * The JSON type of the value ("string", "integer", "number", "boolean", "array" or "object").
     */
    String type;

    /**
     * Whether an invocation must supply a value.
     */
    boolean required;

    /**
     * A human-readable description, taken from the parameter or its schema.
     */
    String description;

    /**
     * The expanded schema of the value. Never contains unresolved references.
     */
    Map<String, Object> schema;
}

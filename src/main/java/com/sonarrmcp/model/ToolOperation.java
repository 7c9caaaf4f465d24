package com.sonarrmcp.model;

/**
 * The closed set of things an agent can ask the gateway to do.
 */
public sealed interface ToolOperation permits ToolOperation.Discover, ToolOperation.Resolve, ToolOperation.Dispatch {

    /**
     * Find tools by category and/or keyword.
     */
    record Discover(DiscoveryQuery query) implements ToolOperation {
    }

    /**
     * Fetch the full schema of one tool.
     */
    record Resolve(String toolName) implements ToolOperation {
    }

    /**
     * Call one tool against the upstream API.
     */
    record Dispatch(Invocation invocation) implements ToolOperation {
    }
}

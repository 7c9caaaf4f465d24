package com.sonarrmcp.service.api;

import com.sonarrmcp.model.ToolOperation;
import com.sonarrmcp.model.ToolOperationResult;
import java.util.Map;

/**
 * The entry point of the gateway: runs discovery, schema and dispatch operations against the live catalog.
 */
public interface ToolOperationHandler {

    ToolOperationResult handle(ToolOperation operation);

    /**
     * Runs a tool call the way an agent issues it: the meta-tool names map to discovery and schema lookups,
     * any other name is dispatched to the upstream API.
     *
     * @param toolName  The tool name.
     * @param arguments The arguments; may be {@code null}.
     * @return The result of the operation the call maps to.
     */
    ToolOperationResult call(String toolName, Map<String, Object> arguments);
}

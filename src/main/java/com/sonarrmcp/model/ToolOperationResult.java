package com.sonarrmcp.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * The outcome of a {@link ToolOperation}; one variant per operation kind.
 */
public sealed interface ToolOperationResult
        permits ToolOperationResult.Discovered, ToolOperationResult.Resolved, ToolOperationResult.Dispatched {

    record Discovered(DiscoveryResult result) implements ToolOperationResult {
    }

    /**
     * @param descriptor  The full descriptor.
     * @param inputSchema The JSON schema of the tool's arguments.
     */
    record Resolved(ToolDescriptor descriptor, Map<String, Object> inputSchema) implements ToolOperationResult {
    }

    /**
     * @param toolName The tool that was called.
     * @param payload  The simplified upstream payload.
     */
    record Dispatched(String toolName, JsonNode payload) implements ToolOperationResult {
    }
}

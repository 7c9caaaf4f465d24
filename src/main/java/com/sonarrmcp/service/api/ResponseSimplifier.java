package com.sonarrmcp.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.sonarrmcp.model.ToolDescriptor;

/**
 * Removes the parts of upstream payloads an agent has no use for, following the policy of the tool's categories.
 */
public interface ResponseSimplifier {

    /**
     * @param tool    The tool that produced the payload.
     * @param payload The raw payload; left untouched.
     * @return A simplified copy of the payload.
     */
    JsonNode simplify(ToolDescriptor tool, JsonNode payload);
}

package com.sonarrmcp.service.api;

import com.sonarrmcp.model.CatalogIndex;
import com.sonarrmcp.model.ToolDescriptor;
import java.util.Map;

public interface SchemaResolver {

    /**
     * Returns the full descriptor of a tool, with every schema already expanded.
     *
     * @param index    The catalog.
     * @param toolName The tool name.
     * @return The descriptor.
     * @throws com.sonarrmcp.exception.ToolNotFoundException if the catalog has no such tool.
     */
    ToolDescriptor resolve(CatalogIndex index, String toolName);

    /**
     * Renders the JSON schema of a tool's arguments ({@code {"type": "object", "properties": ..., "required": ...}}).
     */
    Map<String, Object> inputSchema(ToolDescriptor descriptor);
}

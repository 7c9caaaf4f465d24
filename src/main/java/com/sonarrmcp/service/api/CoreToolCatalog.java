package com.sonarrmcp.service.api;

import com.sonarrmcp.model.CatalogIndex;
import com.sonarrmcp.model.ToolDescriptor;
import java.util.List;
import java.util.Optional;

/**
 * The small tool set an agent sees before it makes any discovery call.
 */
public interface CoreToolCatalog {

    String DISCOVER_TOOLS = "discover_tools";
    String GET_TOOL_SCHEMA = "get_tool_schema";

    /**
     * @param index The catalog the configured core tools are looked up in.
     * @return The meta-tools followed by the configured tools present in the catalog, capped at the configured size.
     */
    List<String> coreTools(CatalogIndex index);

    /**
     * @param name A tool name.
     * @return The hand-authored descriptor if the name is one of the meta-tools.
     */
    Optional<ToolDescriptor> metaTool(String name);
}

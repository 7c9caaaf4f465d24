package com.sonarrmcp.service.impl;

import com.sonarrmcp.config.GatewayProperties;
import com.sonarrmcp.model.CatalogIndex;
import com.sonarrmcp.model.ParameterLocation;
import com.sonarrmcp.model.ToolDescriptor;
import com.sonarrmcp.model.ToolParameter;
import com.sonarrmcp.service.api.CoreToolCatalog;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class CoreToolCatalogImpl implements CoreToolCatalog {

    static final String META_TAG = "meta";

    private final Map<String, ToolDescriptor> metaTools;
    private final GatewayProperties.CoreTools settings;

    public CoreToolCatalogImpl(GatewayProperties properties) {
        this.settings = properties.getCoreTools();
        Map<String, ToolDescriptor> tools = new LinkedHashMap<>();
        tools.put(DISCOVER_TOOLS, discoverToolsDescriptor(properties.getDiscovery()));
        tools.put(GET_TOOL_SCHEMA, getToolSchemaDescriptor());
        this.metaTools = Collections.unmodifiableMap(tools);
    }

    @Override
    public List<String> coreTools(CatalogIndex index) {
        Set<String> names = new LinkedHashSet<>(metaTools.keySet());
        for (String name : settings.getNames()) {
            if (index.contains(name)) {
                names.add(name);
            } else {
                log.debug("Core tool '{}' is not in the catalog; skipping it.", name);
            }
        }
        List<String> core = new ArrayList<>(names);
        int cap = Math.max(metaTools.size(), settings.getMaxSize());
        return List.copyOf(core.subList(0, Math.min(cap, core.size())));
    }

    @Override
    public Optional<ToolDescriptor> metaTool(String name) {
        return Optional.ofNullable(name).map(metaTools::get);
    }

    private static ToolDescriptor discoverToolsDescriptor(GatewayProperties.Discovery discovery) {
        return ToolDescriptor.builder()
                .name(DISCOVER_TOOLS)
                .summary("Find API tools by category or keyword. Call without arguments to see the core tools.")
                .description("Returns tool names, summaries and categories only. Use " + GET_TOOL_SCHEMA
                        + " to fetch the parameters of a tool before calling it.")
                .parameters(List.of(
                        argument("category", "string", false, "Category tag to filter on, e.g. 'series' or 'queue'."),
                        argument("keyword", "string", false,
                                "Text matched against tool names, categories, summaries and parameter names."),
                        argument("max_results", "integer", false, "Maximum number of tools to return (default "
                                + discovery.getDefaultMaxResults() + ", at most " + discovery.getMaxResultsCeiling()
                                + ").")))
                .tags(metaTags())
                .build();
    }

    private static ToolDescriptor getToolSchemaDescriptor() {
        return ToolDescriptor.builder()
                .name(GET_TOOL_SCHEMA)
                .summary("Get the full parameter schema of a tool found with " + DISCOVER_TOOLS + ".")
                .parameters(List.of(argument("tool_name", "string", true, "The exact tool name.")))
                .tags(metaTags())
                .build();
    }

    private static ToolParameter argument(String name, String type, boolean required, String description) {
        return ToolParameter.builder()
                .name(name)
                .location(ParameterLocation.ARGUMENT)
                .type(type)
                .required(required)
                .description(description)
                .schema(Map.of("type", type))
                .build();
    }

    private static TreeSet<String> metaTags() {
        return new TreeSet<>(Set.of(META_TAG));
    }
}

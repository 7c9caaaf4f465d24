package com.sonarrmcp.service.impl;

import com.sonarrmcp.exception.ToolNotFoundException;
import com.sonarrmcp.model.CatalogIndex;
import com.sonarrmcp.model.ToolDescriptor;
import com.sonarrmcp.model.ToolParameter;
import com.sonarrmcp.service.api.SchemaResolver;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Schemas are expanded when the catalog is built, so resolving a tool is a plain lookup.
 */
@Service
public class SchemaResolverImpl implements SchemaResolver {

    @Override
    public ToolDescriptor resolve(CatalogIndex index, String toolName) {
        return index.find(toolName).orElseThrow(() -> new ToolNotFoundException(toolName));
    }

    @Override
    public Map<String, Object> inputSchema(ToolDescriptor descriptor) {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        for (ToolParameter parameter : descriptor.getParameters()) {
            Map<String, Object> property = new LinkedHashMap<>();
            if (parameter.getSchema() != null) {
                property.putAll(parameter.getSchema());
            }
            property.putIfAbsent("type", parameter.getType());
            if (parameter.getDescription() != null) {
                property.put("description", parameter.getDescription());
            }
            properties.put(parameter.getName(), Collections.unmodifiableMap(property));
            if (parameter.isRequired()) {
                required.add(parameter.getName());
            }
        }

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", Collections.unmodifiableMap(properties));
        schema.put("required", List.copyOf(required));
        return Collections.unmodifiableMap(schema);
    }
}

package com.sonarrmcp.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.InvalidPathException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import com.jayway.jsonpath.spi.json.JacksonJsonNodeJsonProvider;
import com.jayway.jsonpath.spi.mapper.JacksonMappingProvider;
import com.sonarrmcp.config.GatewayProperties;
import com.sonarrmcp.exception.ToolGatewayException;
import com.sonarrmcp.model.ToolDescriptor;
import com.sonarrmcp.service.api.ResponseSimplifier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Applies the configured simplification policies with JsonPath deletions on a copy of the payload, then cuts long
 * text values.
 */
@Service
@Slf4j
public class JsonPathResponseSimplifier implements ResponseSimplifier {

    private static final String ELLIPSIS = "...";

    private final Configuration configuration = Configuration.builder()
            .jsonProvider(new JacksonJsonNodeJsonProvider())
            .mappingProvider(new JacksonMappingProvider())
            .build();

    private final CompiledPolicy defaults;
    private final Map<String, CompiledPolicy> categories = new LinkedHashMap<>();

    public JsonPathResponseSimplifier(GatewayProperties properties) {
        GatewayProperties.Simplification simplification = properties.getSimplification();
        this.defaults = compile("defaults", simplification.getDefaults());
        simplification.getCategories().forEach((category, policy) ->
                categories.put(category.toLowerCase(Locale.ROOT), compile(category, policy)));
    }

    @Override
    public JsonNode simplify(ToolDescriptor tool, JsonNode payload) {
        if (payload == null || !payload.isContainerNode()) {
            return payload;
        }

        Map<String, JsonPath> dropPaths = new LinkedHashMap<>(defaults.dropPaths());
        int maxLength = defaults.maxStringLength();
        for (String tag : tool.getTags()) {
            CompiledPolicy policy = categories.get(tag);
            if (policy != null) {
                dropPaths.putAll(policy.dropPaths());
                maxLength = smallestPositive(maxLength, policy.maxStringLength());
            }
        }
        if (dropPaths.isEmpty() && maxLength <= 0) {
            return payload;
        }

        JsonNode copy = payload.deepCopy();
        DocumentContext document = JsonPath.using(configuration).parse(copy);
        dropPaths.forEach((expression, path) -> {
            try {
                document.delete(path);
            } catch (PathNotFoundException e) {
                log.trace("Nothing to drop at {} for tool {}", expression, tool.getName());
            }
        });

        JsonNode simplified = document.json();
        if (maxLength > 0) {
            truncateText(simplified, maxLength);
        }
        return simplified;
    }

    private CompiledPolicy compile(String name, GatewayProperties.Policy policy) {
        Map<String, JsonPath> paths = new LinkedHashMap<>();
        if (policy == null) {
            return new CompiledPolicy(paths, 0);
        }
        for (String expression : policy.getDropPaths()) {
            try {
                paths.put(expression, JsonPath.compile(expression));
            } catch (InvalidPathException e) {
                throw new ToolGatewayException("Invalid drop path '" + expression + "' in simplification policy '"
                        + name + "': " + e.getMessage(), e);
            }
        }
        return new CompiledPolicy(paths, policy.getMaxStringLength());
    }

    private static int smallestPositive(int current, int candidate) {
        if (candidate <= 0) {
            return current;
        }
        return current <= 0 ? candidate : Math.min(current, candidate);
    }

    private static void truncateText(JsonNode node, int maxLength) {
        if (node instanceof ObjectNode object) {
            List<String> fields = new ArrayList<>();
            object.fieldNames().forEachRemaining(fields::add);
            for (String field : fields) {
                JsonNode child = object.get(field);
                if (child.isTextual()) {
                    object.set(field, truncate(child, maxLength));
                } else {
                    truncateText(child, maxLength);
                }
            }
        } else if (node instanceof ArrayNode array) {
            for (int i = 0; i < array.size(); i++) {
                JsonNode child = array.get(i);
                if (child.isTextual()) {
                    array.set(i, truncate(child, maxLength));
                } else {
                    truncateText(child, maxLength);
                }
            }
        }
    }

    private static JsonNode truncate(JsonNode text, int maxLength) {
        String value = text.asText();
        return value.length() > maxLength ? TextNode.valueOf(value.substring(0, maxLength) + ELLIPSIS) : text;
    }

    private record CompiledPolicy(Map<String, JsonPath> dropPaths, int maxStringLength) {
    }
}

package com.sonarrmcp.service.impl;

import com.sonarrmcp.config.GatewayProperties;
import com.sonarrmcp.exception.SchemaException;
import com.sonarrmcp.model.CatalogIndex;
import com.sonarrmcp.model.ParameterLocation;
import com.sonarrmcp.model.ToolDescriptor;
import com.sonarrmcp.model.ToolParameter;
import com.sonarrmcp.service.api.CoreToolCatalog;
import com.sonarrmcp.service.api.SchemaIndexService;
import com.sonarrmcp.service.api.ToolCategorizer;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.RequestBody;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class SchemaIndexServiceImpl implements SchemaIndexService {

    private static final String SCHEMAS_PREFIX = "#/components/schemas/";
    private static final String PARAMETERS_PREFIX = "#/components/parameters/";
    private static final String REQUEST_BODIES_PREFIX = "#/components/requestBodies/";
    private static final String RESPONSES_PREFIX = "#/components/responses/";

    private static final Set<PathItem.HttpMethod> SUPPORTED_METHODS = EnumSet.of(PathItem.HttpMethod.GET,
            PathItem.HttpMethod.PUT, PathItem.HttpMethod.POST, PathItem.HttpMethod.DELETE, PathItem.HttpMethod.PATCH);

    // Header parameters the HTTP client owns; OpenAPI says they are ignored when declared.
    private static final Set<String> RESERVED_HEADERS = Set.of("accept", "content-type", "authorization");

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^}/]+)}");

    private static final String BODY_PARAMETER = "body";

    private final ToolCategorizer categorizer;
    private final int maxSchemaDepth;

    public SchemaIndexServiceImpl(ToolCategorizer categorizer, GatewayProperties properties) {
        this.categorizer = categorizer;
        this.maxSchemaDepth = Math.max(1, properties.getCatalog().getMaxSchemaDepth());
    }

    /**
     * {@inheritDoc}
     * This implementation uses the swagger-parser library to read the document, leaving every reference unresolved
     * so that expansion stays under the control of {@link #build(OpenAPI)}.
     */
    @Override
    public CatalogIndex load(String location) {
        log.info("Loading OpenAPI document from: {}", location);
        return build(parseWith(parser -> parser.readLocation(location, null, parseOptions()), location));
    }

    @Override
    public CatalogIndex parse(String content) {
        return build(parseWith(parser -> parser.readContents(content, null, parseOptions()), "inline content"));
    }

    private OpenAPI parseWith(Function<OpenAPIV3Parser, SwaggerParseResult> reader, String source) {
        SwaggerParseResult result;
        try {
            result = reader.apply(new OpenAPIV3Parser());
        } catch (RuntimeException e) {
            throw new SchemaException("Failed to read the OpenAPI document from " + source + ": " + e.getMessage(), e);
        }
        if (result == null || result.getOpenAPI() == null) {
            List<String> messages = result == null || result.getMessages() == null ? List.of() : result.getMessages();
            throw new SchemaException("Failed to parse the OpenAPI document from " + source
                    + (messages.isEmpty() ? "" : ": " + String.join("; ", messages)));
        }
        if (result.getMessages() != null && !result.getMessages().isEmpty()) {
            log.debug("OpenAPI parser reported {} message(s): {}", result.getMessages().size(), result.getMessages());
        }
        return result.getOpenAPI();
    }

    private static ParseOptions parseOptions() {
        ParseOptions options = new ParseOptions();
        options.setResolve(false);
        return options;
    }

    /**
     * {@inheritDoc}
     * Every path and supported method becomes one {@link ToolDescriptor}. Paths and methods are visited in document
     * order, which makes name collision suffixes stable across rebuilds.
     */
    @Override
    public CatalogIndex build(OpenAPI openAPI) {
        if (openAPI == null || openAPI.getPaths() == null || openAPI.getPaths().isEmpty()) {
            throw new SchemaException("The OpenAPI document declares no paths.");
        }

        // Upstream operations never shadow the meta-tools.
        Set<String> usedNames = new HashSet<>(Set.of(CoreToolCatalog.DISCOVER_TOOLS, CoreToolCatalog.GET_TOOL_SCHEMA));
        List<ToolDescriptor> tools = new ArrayList<>();
        openAPI.getPaths().forEach((path, pathItem) -> {
            if (pathItem == null) {
                return;
            }
            pathItem.readOperationsMap().forEach((method, operation) -> {
                if (!SUPPORTED_METHODS.contains(method)) {
                    log.debug("Skipping {} {}: method not exposed as a tool", method, path);
                    return;
                }
                tools.add(createDescriptor(method, operation, path, pathItem, openAPI, usedNames));
            });
        });

        String title = openAPI.getInfo() != null ? openAPI.getInfo().getTitle() : null;
        String version = openAPI.getInfo() != null ? openAPI.getInfo().getVersion() : null;
        CatalogIndex index = CatalogIndex.of(title, version, tools);
        log.info("Indexed {} tools from '{}' {}.", index.size(), title, version);
        return index;
    }

    private ToolDescriptor createDescriptor(PathItem.HttpMethod method, Operation operation, String path,
                                            PathItem pathItem, OpenAPI openAPI, Set<String> usedNames) {
        String baseName = operation.getOperationId() != null && !operation.getOperationId().isBlank()
                ? toSnakeCase(operation.getOperationId())
                : generateName(method.name(), path);
        String name = uniqueName(baseName, usedNames);

        Map<String, ToolParameter> parameters = new LinkedHashMap<>();
        for (Parameter parameter : mergeParameters(pathItem.getParameters(), operation.getParameters(), openAPI)) {
            ToolParameter toolParameter = createParameter(parameter, openAPI);
            if (toolParameter == null) {
                continue;
            }
            if (parameters.putIfAbsent(toolParameter.getName(), toolParameter) != null) {
                log.warn("Tool '{}' declares parameter '{}' twice; keeping the first.", name, toolParameter.getName());
            }
        }
        addPathPlaceholders(name, path, parameters);

        Map<String, Object> requestBodySchema = null;
        boolean flattened = false;
        RequestBody requestBody = resolveRequestBody(operation.getRequestBody(), openAPI);
        if (requestBody != null && requestBody.getContent() != null && !requestBody.getContent().isEmpty()) {
            MediaType mediaType = preferredMediaType(requestBody.getContent());
            requestBodySchema = expand(mediaType.getSchema(), openAPI, new ArrayDeque<>());
            flattened = addBodyParameters(name, requestBody, requestBodySchema, parameters);
        }

        return ToolDescriptor.builder()
                .name(name)
                .summary(summaryOf(method.name(), path, operation))
                .description(operation.getDescription())
                .method(method.name())
                .path(path)
                .parameters(List.copyOf(parameters.values()))
                .requestBodySchema(requestBodySchema)
                .responseSchema(responseSchema(operation, openAPI))
                .tags(Collections.unmodifiableSortedSet(categorizer.tag(method.name(), path, operation.getTags())))
                .flattenedBody(flattened)
                .build();
    }

    /**
     * Path-level parameters apply to every operation of the path; an operation parameter with the same name and
     * location replaces the path-level one.
     */
    private List<Parameter> mergeParameters(List<Parameter> pathLevel, List<Parameter> operationLevel,
                                            OpenAPI openAPI) {
        Map<String, Parameter> merged = new LinkedHashMap<>();
        if (pathLevel != null) {
            for (Parameter parameter : pathLevel) {
                Parameter resolved = resolveParameter(parameter, openAPI);
                merged.put(resolved.getIn() + ":" + resolved.getName(), resolved);
            }
        }
        if (operationLevel != null) {
            for (Parameter parameter : operationLevel) {
                Parameter resolved = resolveParameter(parameter, openAPI);
                merged.put(resolved.getIn() + ":" + resolved.getName(), resolved);
            }
        }
        return new ArrayList<>(merged.values());
    }

    private ToolParameter createParameter(Parameter parameter, OpenAPI openAPI) {
        ParameterLocation location = ParameterLocation.fromOpenApi(parameter.getIn());
        if (location == null) {
            log.debug("Skipping parameter '{}' in '{}'", parameter.getName(), parameter.getIn());
            return null;
        }
        if (location == ParameterLocation.HEADER
                && RESERVED_HEADERS.contains(parameter.getName().toLowerCase(Locale.ROOT))) {
            return null;
        }

        Schema<?> schema = parameter.getSchema();
        if (schema == null && parameter.getContent() != null && !parameter.getContent().isEmpty()) {
            schema = preferredMediaType(parameter.getContent()).getSchema();
        }
        Map<String, Object> expanded = expand(schema, openAPI, new ArrayDeque<>());
        String description = parameter.getDescription() != null
                ? parameter.getDescription()
                : (String) expanded.get("description");

        return ToolParameter.builder()
                .name(parameter.getName())
                .location(location)
                .type(typeOf(expanded))
                .required(location == ParameterLocation.PATH || Boolean.TRUE.equals(parameter.getRequired()))
                .description(description)
                .schema(expanded)
                .build();
    }

    private void addPathPlaceholders(String toolName, String path, Map<String, ToolParameter> parameters) {
        Set<String> placeholders = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(path);
        while (matcher.find()) {
            placeholders.add(matcher.group(1));
        }

        for (ToolParameter parameter : parameters.values()) {
            if (parameter.getLocation() == ParameterLocation.PATH && !placeholders.contains(parameter.getName())) {
                throw new SchemaException("Path parameter '" + parameter.getName() + "' of tool '" + toolName
                        + "' has no placeholder in " + path);
            }
        }
        for (String placeholder : placeholders) {
            ToolParameter existing = parameters.get(placeholder);
            if (existing == null) {
                parameters.put(placeholder, ToolParameter.builder()
                        .name(placeholder)
                        .location(ParameterLocation.PATH)
                        .type("string")
                        .required(true)
                        .description("Path parameter " + placeholder)
                        .schema(Map.of("type", "string"))
                        .build());
            } else if (existing.getLocation() != ParameterLocation.PATH) {
                throw new SchemaException("Placeholder '{" + placeholder + "}' of tool '" + toolName
                        + "' collides with a " + existing.getLocation().name().toLowerCase(Locale.ROOT)
                        + " parameter of the same name.");
            }
        }
    }

    /**
     * Adds the body parameters of an operation.
     *
     * @return {@code true} if the body was flattened into one parameter per property.
     */
    private boolean addBodyParameters(String toolName, RequestBody requestBody, Map<String, Object> bodySchema,
                                      Map<String, ToolParameter> parameters) {
        Map<String, Object> properties = new LinkedHashMap<>();
        Set<String> required = new HashSet<>();
        collectProperties(bodySchema, properties, required);

        if (properties.isEmpty()) {
            String name = parameters.containsKey(BODY_PARAMETER) ? "request_body" : BODY_PARAMETER;
            parameters.put(name, ToolParameter.builder()
                    .name(name)
                    .location(ParameterLocation.BODY)
                    .type(typeOf(bodySchema))
                    .required(Boolean.TRUE.equals(requestBody.getRequired()))
                    .description(requestBody.getDescription() != null
                            ? requestBody.getDescription()
                            : (String) bodySchema.get("description"))
                    .schema(bodySchema)
                    .build());
            return false;
        }

        properties.forEach((property, value) -> {
            if (parameters.containsKey(property)) {
                log.warn("Tool '{}': body property '{}' collides with a parameter of the same name and is dropped.",
                        toolName, property);
                return;
            }
            Map<String, Object> propertySchema = value instanceof Map<?, ?> raw ? asSchema(raw) : Map.of();
            parameters.put(property, ToolParameter.builder()
                    .name(property)
                    .location(ParameterLocation.BODY)
                    .type(typeOf(propertySchema))
                    .required(required.contains(property))
                    .description((String) propertySchema.get("description"))
                    .schema(propertySchema)
                    .build());
        });
        return true;
    }

    private static void collectProperties(Map<String, Object> schema, Map<String, Object> properties,
                                          Set<String> required) {
        if (schema.get("properties") instanceof Map<?, ?> own) {
            own.forEach((key, value) -> properties.putIfAbsent(String.valueOf(key), value));
        }
        if (schema.get("required_fields") instanceof List<?> fields) {
            fields.forEach(field -> required.add(String.valueOf(field)));
        }
        if (schema.get("allOf") instanceof List<?> parts) {
            for (Object part : parts) {
                if (part instanceof Map<?, ?> partSchema) {
                    collectProperties(asSchema(partSchema), properties, required);
                }
            }
        }
    }

    private Map<String, Object> responseSchema(Operation operation, OpenAPI openAPI) {
        if (operation.getResponses() == null) {
            return null;
        }
        for (Map.Entry<String, ApiResponse> entry : operation.getResponses().entrySet()) {
            if (!entry.getKey().startsWith("2")) {
                continue;
            }
            ApiResponse response = resolveResponse(entry.getValue(), openAPI);
            if (response != null && response.getContent() != null && !response.getContent().isEmpty()) {
                return expand(preferredMediaType(response.getContent()).getSchema(), openAPI, new ArrayDeque<>());
            }
        }
        return null;
    }

    /**
     * Recursively converts a swagger {@link Schema} into a plain, unmodifiable map with every {@code $ref} expanded.
     * <p>
     * The names of the component schemas being expanded are kept on {@code refStack}. A reference that is already on
     * the stack, or that would push the stack beyond the configured depth, is replaced by a truncation marker.
     *
     * @param schema   The schema to process.
     * @param openAPI  The root OpenAPI object, used to look up references.
     * @param refStack The component schemas currently being expanded.
     * @return A simplified map representing the schema.
     */
    private Map<String, Object> expand(Schema<?> schema, OpenAPI openAPI, Deque<String> refStack) {
        if (schema == null) {
            return Collections.emptyMap();
        }

        if (schema.get$ref() != null) {
            String name = referenceName(schema.get$ref(), SCHEMAS_PREFIX);
            if (refStack.contains(name) || refStack.size() >= maxSchemaDepth) {
                return truncated(name);
            }
            Schema<?> target = component(openAPI, Components::getSchemas, name, schema.get$ref());
            refStack.push(name);
            try {
                return expand(target, openAPI, refStack);
            } finally {
                refStack.pop();
            }
        }

        Map<String, Object> map = new LinkedHashMap<>();
        String type = schemaType(schema);
        if (type != null) {
            map.put("type", type);
        }
        putIfPresent(map, "format", schema.getFormat());
        putIfPresent(map, "description", schema.getDescription());
        if (schema.getEnum() != null) {
            map.put("enum", Collections.unmodifiableList(new ArrayList<>(schema.getEnum())));
        }
        putIfPresent(map, "default", schema.getDefault());
        if (Boolean.TRUE.equals(schema.getNullable())
                || (schema.getTypes() != null && schema.getTypes().contains("null"))) {
            map.put("nullable", true);
        }
        if (schema.getRequired() != null && !schema.getRequired().isEmpty()) {
            map.put("required_fields", List.copyOf(schema.getRequired()));
        }

        if (schema.getProperties() != null && !schema.getProperties().isEmpty()) {
            Map<String, Object> properties = new LinkedHashMap<>();
            schema.getProperties().forEach((key, value) -> properties.put(key, expand(value, openAPI, refStack)));
            map.put("properties", Collections.unmodifiableMap(properties));
        }
        if (schema.getItems() != null) {
            map.put("items", expand(schema.getItems(), openAPI, refStack));
        }
        Object additional = schema.getAdditionalProperties();
        if (additional instanceof Schema<?> additionalSchema) {
            map.put("additionalProperties", expand(additionalSchema, openAPI, refStack));
        } else if (additional instanceof Boolean) {
            map.put("additionalProperties", additional);
        }
        putComposition(map, "allOf", schema.getAllOf(), openAPI, refStack);
        putComposition(map, "oneOf", schema.getOneOf(), openAPI, refStack);
        putComposition(map, "anyOf", schema.getAnyOf(), openAPI, refStack);

        return Collections.unmodifiableMap(map);
    }

    private void putComposition(Map<String, Object> map, String key, List<Schema> parts, OpenAPI openAPI,
                                Deque<String> refStack) {
        if (parts == null || parts.isEmpty()) {
            return;
        }
        List<Object> expanded = new ArrayList<>();
        for (Schema<?> part : parts) {
            expanded.add(expand(part, openAPI, refStack));
        }
        map.put(key, Collections.unmodifiableList(expanded));
    }

    private static Map<String, Object> truncated(String name) {
        Map<String, Object> marker = new LinkedHashMap<>();
        marker.put("truncated", true);
        marker.put("ref", name);
        marker.put("description", "schema truncated");
        return Collections.unmodifiableMap(marker);
    }

    private static String schemaType(Schema<?> schema) {
        if (schema.getType() != null) {
            return schema.getType();
        }
        if (schema.getTypes() != null) {
            return schema.getTypes().stream().filter(t -> !"null".equals(t)).sorted().findFirst().orElse(null);
        }
        if (schema.getProperties() != null || schema.getAllOf() != null) {
            return "object";
        }
        return null;
    }

    static String typeOf(Map<String, Object> schema) {
        Object type = schema.get("type");
        if (type instanceof String value) {
            return value;
        }
        if (schema.containsKey("properties") || schema.containsKey("allOf") || schema.containsKey("truncated")) {
            return "object";
        }
        return "string";
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private Parameter resolveParameter(Parameter parameter, OpenAPI openAPI) {
        Parameter current = parameter;
        for (int hops = 0; current.get$ref() != null; hops++) {
            guardHops(hops, current.get$ref());
            String name = referenceName(current.get$ref(), PARAMETERS_PREFIX);
            current = component(openAPI, Components::getParameters, name, current.get$ref());
        }
        if (current.getName() == null || current.getIn() == null) {
            throw new SchemaException("Parameter without name or location: " + current);
        }
        return current;
    }

    private RequestBody resolveRequestBody(RequestBody requestBody, OpenAPI openAPI) {
        RequestBody current = requestBody;
        for (int hops = 0; current != null && current.get$ref() != null; hops++) {
            guardHops(hops, current.get$ref());
            String name = referenceName(current.get$ref(), REQUEST_BODIES_PREFIX);
            current = component(openAPI, Components::getRequestBodies, name, current.get$ref());
        }
        return current;
    }

    private ApiResponse resolveResponse(ApiResponse response, OpenAPI openAPI) {
        ApiResponse current = response;
        for (int hops = 0; current != null && current.get$ref() != null; hops++) {
            guardHops(hops, current.get$ref());
            String name = referenceName(current.get$ref(), RESPONSES_PREFIX);
            current = component(openAPI, Components::getResponses, name, current.get$ref());
        }
        return current;
    }

    private void guardHops(int hops, String ref) {
        if (hops >= maxSchemaDepth) {
            throw new SchemaException("Reference chain too long at " + ref);
        }
    }

    private static String referenceName(String ref, String prefix) {
        if (!ref.startsWith(prefix)) {
            throw new SchemaException("Unsupported reference '" + ref + "': only local " + prefix + " references"
                    + " are allowed here.");
        }
        return ref.substring(prefix.length());
    }

    private static <T> T component(OpenAPI openAPI, Function<Components, Map<String, T>> section, String name,
                                   String ref) {
        Map<String, T> components = openAPI.getComponents() == null ? null : section.apply(openAPI.getComponents());
        T target = components == null ? null : components.get(name);
        if (target == null) {
            throw new SchemaException("Unresolvable reference '" + ref + "'.");
        }
        return target;
    }

    /**
     * Picks the JSON representation of a body if there is one ("application/json" first, then any "+json" or
     * "text/json" flavour), otherwise the first declared media type.
     */
    private static MediaType preferredMediaType(Content content) {
        MediaType json = content.get("application/json");
        if (json != null) {
            return json;
        }
        return content.entrySet().stream()
                .filter(entry -> entry.getKey().toLowerCase(Locale.ROOT).contains("json"))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElseGet(() -> content.values().iterator().next());
    }

    private static String summaryOf(String method, String path, Operation operation) {
        if (operation.getSummary() != null && !operation.getSummary().isBlank()) {
            return operation.getSummary().trim();
        }
        if (operation.getDescription() != null && !operation.getDescription().isBlank()) {
            return operation.getDescription().trim();
        }
        return method + " " + path;
    }

    /**
     * Normalizes an operationId to snake_case: "getQualityProfiles" becomes "get_quality_profiles" and
     * "GetAPIKey" becomes "get_api_key".
     */
    static String toSnakeCase(String operationId) {
        String snake = operationId
                .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
                .replaceAll("([A-Z]+)([A-Z][a-z])", "$1_$2")
                .replaceAll("[^A-Za-z0-9]+", "_")
                .replaceAll("^_+|_+$", "")
                .toLowerCase(Locale.ROOT);
        if (snake.isEmpty()) {
            return "operation";
        }
        return Character.isDigit(snake.charAt(0)) ? "_" + snake : snake;
    }

    private String generateName(String httpMethod, String path) {
        List<String> parts = new ArrayList<>();
        parts.add(httpMethod.toLowerCase(Locale.ROOT));
        for (String segment : categorizer.meaningfulSegments(path)) {
            parts.add(PathToolCategorizer.isPlaceholder(segment)
                    ? "by_" + segment.substring(1, segment.length() - 1)
                    : segment);
        }
        return toSnakeCase(String.join("_", parts));
    }

    private static Map<String, Object> asSchema(Map<?, ?> raw) {
        Map<String, Object> schema = new LinkedHashMap<>();
        raw.forEach((key, value) -> schema.put(String.valueOf(key), value));
        return schema;
    }

    private static String uniqueName(String baseName, Collection<String> usedNames) {
        String name = baseName;
        for (int suffix = 2; usedNames.contains(name); suffix++) {
            name = baseName + "_" + suffix;
        }
        usedNames.add(name);
        return name;
    }
}

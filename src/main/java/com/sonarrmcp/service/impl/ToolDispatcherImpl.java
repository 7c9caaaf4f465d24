package com.sonarrmcp.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.sonarrmcp.exception.ArgumentValidationException;
import com.sonarrmcp.exception.UpstreamException;
import com.sonarrmcp.model.CatalogIndex;
import com.sonarrmcp.model.Invocation;
import com.sonarrmcp.model.ParameterLocation;
import com.sonarrmcp.model.ToolDescriptor;
import com.sonarrmcp.model.ToolParameter;
import com.sonarrmcp.model.UpstreamRequest;
import com.sonarrmcp.model.UpstreamResponse;
import com.sonarrmcp.service.api.ResponseSimplifier;
import com.sonarrmcp.service.api.SchemaResolver;
import com.sonarrmcp.service.api.ToolDispatcher;
import com.sonarrmcp.service.api.UpstreamClient;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriUtils;

@Service
@Slf4j
public class ToolDispatcherImpl implements ToolDispatcher {

    private final SchemaResolver schemaResolver;
    private final UpstreamClient upstreamClient;
    private final ResponseSimplifier responseSimplifier;

    public ToolDispatcherImpl(SchemaResolver schemaResolver, UpstreamClient upstreamClient,
                              ResponseSimplifier responseSimplifier) {
        this.schemaResolver = schemaResolver;
        this.upstreamClient = upstreamClient;
        this.responseSimplifier = responseSimplifier;
    }

    /**
     * {@inheritDoc}
     * Arguments are checked completely before anything is sent: every unknown, missing and invalid argument is
     * reported in a single {@link ArgumentValidationException}.
     */
    @Override
    public JsonNode dispatch(CatalogIndex index, Invocation invocation) {
        ToolDescriptor tool = schemaResolver.resolve(index, invocation.toolName());
        Map<String, Object> arguments = invocation.arguments() == null
                ? Collections.emptyMap()
                : invocation.arguments();

        Map<String, Object> values = validate(tool, arguments);
        UpstreamRequest request = buildRequest(tool, values);
        log.info("Dispatching tool '{}' -> {} {}", tool.getName(), request.method(), request.path());

        UpstreamResponse response;
        try {
            response = upstreamClient.execute(request);
        } catch (UpstreamException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected failure calling tool '{}'", tool.getName(), e);
            throw UpstreamException.transport(tool.getName(), e.getMessage(), e);
        }

        if (!response.isSuccessful()) {
            log.warn("Tool '{}' failed upstream with status {}", tool.getName(), response.status());
            throw UpstreamException.forStatus(tool.getName(), response.status(), bodyText(response.body()));
        }
        return responseSimplifier.simplify(tool, response.body());
    }

    /**
     * @return The coerced argument values keyed by parameter name, in parameter order.
     */
    Map<String, Object> validate(ToolDescriptor tool, Map<String, Object> arguments) {
        Map<String, ToolParameter> parameters = new LinkedHashMap<>();
        tool.getParameters().forEach(parameter -> parameters.put(parameter.getName(), parameter));

        List<String> unknown = new ArrayList<>(new TreeSet<>(arguments.keySet()));
        unknown.removeAll(parameters.keySet());

        List<String> missing = new ArrayList<>();
        Map<String, String> invalid = new TreeMap<>();
        Map<String, Object> values = new LinkedHashMap<>();
        for (ToolParameter parameter : parameters.values()) {
            Object value = arguments.get(parameter.getName());
            if (value == null) {
                if (parameter.isRequired()) {
                    missing.add(parameter.getName());
                }
                continue;
            }
            try {
                values.put(parameter.getName(), coerce(parameter, value));
            } catch (IllegalArgumentException e) {
                invalid.put(parameter.getName(), e.getMessage());
            }
        }
        Collections.sort(missing);

        if (!missing.isEmpty() || !unknown.isEmpty() || !invalid.isEmpty()) {
            throw new ArgumentValidationException(tool.getName(), missing, unknown, invalid);
        }
        return values;
    }

    private UpstreamRequest buildRequest(ToolDescriptor tool, Map<String, Object> values) {
        String path = tool.getPath();
        Map<String, List<String>> query = new LinkedHashMap<>();
        Map<String, String> headers = new LinkedHashMap<>();
        Map<String, Object> bodyFields = new LinkedHashMap<>();
        Object body = null;

        for (ToolParameter parameter : tool.getParameters()) {
            if (!values.containsKey(parameter.getName())) {
                continue;
            }
            Object value = values.get(parameter.getName());
            switch (parameter.getLocation()) {
                case PATH -> path = path.replace("{" + parameter.getName() + "}",
                        UriUtils.encodePathSegment(String.valueOf(value), StandardCharsets.UTF_8));
                case QUERY -> query.put(parameter.getName(), asStrings(value));
                case HEADER -> headers.put(parameter.getName(), String.join(",", asStrings(value)));
                case BODY -> {
                    if (tool.isFlattenedBody()) {
                        bodyFields.put(parameter.getName(), value);
                    } else {
                        body = value;
                    }
                }
                default -> log.debug("Parameter '{}' of tool '{}' is not sent upstream", parameter.getName(),
                        tool.getName());
            }
        }
        if (tool.isFlattenedBody() && !bodyFields.isEmpty()) {
            body = bodyFields;
        }
        return new UpstreamRequest(tool.getName(), tool.getMethod(), path, query, headers, body);
    }

    private static List<String> asStrings(Object value) {
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(String::valueOf).collect(Collectors.toList());
        }
        return List.of(String.valueOf(value));
    }

    private static String bodyText(JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            return "";
        }
        return body.isTextual() ? body.asText() : body.toString();
    }

    /**
     * Converts an argument to the parameter's declared type.
     *
     * @throws IllegalArgumentException with a short reason if the value does not fit.
     */
    static Object coerce(ToolParameter parameter, Object value) {
        if (parameter.getLocation() == ParameterLocation.PATH) {
            if (value instanceof Map || value instanceof Collection) {
                throw new IllegalArgumentException("expected a single value");
            }
            if (String.valueOf(value).isBlank()) {
                throw new IllegalArgumentException("must not be blank");
            }
        }
        if ("array".equals(parameter.getType())) {
            return coerceArray(itemType(parameter.getSchema()), value);
        }
        return coerceScalar(parameter.getType(), value);
    }

    private static String itemType(Map<String, Object> schema) {
        if (schema != null && schema.get("items") instanceof Map<?, ?> items && items.get("type") instanceof String type) {
            return type;
        }
        return null;
    }

    private static List<Object> coerceArray(String itemType, Object value) {
        List<Object> items = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            items.addAll(collection);
        } else if (value instanceof String text) {
            for (String item : text.split(",")) {
                if (!item.isBlank()) {
                    items.add(item.trim());
                }
            }
        } else if (value instanceof Map) {
            throw new IllegalArgumentException("expected an array");
        } else {
            items.add(value);
        }

        List<Object> coerced = new ArrayList<>(items.size());
        for (Object item : items) {
            coerced.add(item == null ? null : coerceScalar(itemType, item));
        }
        return coerced;
    }

    private static Object coerceScalar(String type, Object value) {
        if (type == null) {
            return value;
        }
        return switch (type) {
            case "integer" -> toInteger(value);
            case "number" -> toNumber(value);
            case "boolean" -> toBoolean(value);
            default -> value;
        };
    }

    private static Object toInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger) {
            return value;
        }
        try {
            if (value instanceof Number number) {
                return new BigDecimal(number.toString()).longValueExact();
            }
            if (value instanceof String text) {
                return Long.parseLong(text.trim());
            }
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("expected an integer but got '" + value + "'");
        }
        throw new IllegalArgumentException("expected an integer but got '" + value + "'");
    }

    private static Object toNumber(Object value) {
        if (value instanceof Number) {
            return value;
        }
        if (value instanceof String text) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("expected a number but got '" + value + "'");
            }
        }
        throw new IllegalArgumentException("expected a number but got '" + value + "'");
    }

    private static Object toBoolean(Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof String text) {
            if ("true".equalsIgnoreCase(text.trim())) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(text.trim())) {
                return Boolean.FALSE;
            }
        }
        throw new IllegalArgumentException("expected true or false but got '" + value + "'");
    }
}

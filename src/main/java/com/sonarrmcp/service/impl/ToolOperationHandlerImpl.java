package com.sonarrmcp.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.sonarrmcp.exception.ArgumentValidationException;
import com.sonarrmcp.model.CatalogIndex;
import com.sonarrmcp.model.DiscoveryQuery;
import com.sonarrmcp.model.DiscoveryResult;
import com.sonarrmcp.model.Invocation;
import com.sonarrmcp.model.ToolDescriptor;
import com.sonarrmcp.model.ToolOperation;
import com.sonarrmcp.model.ToolOperationResult;
import com.sonarrmcp.service.api.CatalogRegistry;
import com.sonarrmcp.service.api.CoreToolCatalog;
import com.sonarrmcp.service.api.DiscoveryService;
import com.sonarrmcp.service.api.SchemaResolver;
import com.sonarrmcp.service.api.ToolDispatcher;
import com.sonarrmcp.service.api.ToolOperationHandler;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class ToolOperationHandlerImpl implements ToolOperationHandler {

    private static final Set<String> DISCOVER_ARGUMENTS = Set.of("category", "keyword", "max_results");
    private static final Set<String> SCHEMA_ARGUMENTS = Set.of("tool_name");
    private static final BigDecimal INT_MAX = BigDecimal.valueOf(Integer.MAX_VALUE);
    private static final BigDecimal INT_MIN = BigDecimal.valueOf(Integer.MIN_VALUE);

    private final CatalogRegistry catalogRegistry;
    private final CoreToolCatalog coreToolCatalog;
    private final DiscoveryService discoveryService;
    private final SchemaResolver schemaResolver;
    private final ToolDispatcher toolDispatcher;

    public ToolOperationHandlerImpl(CatalogRegistry catalogRegistry, CoreToolCatalog coreToolCatalog,
                                    DiscoveryService discoveryService, SchemaResolver schemaResolver,
                                    ToolDispatcher toolDispatcher) {
        this.catalogRegistry = catalogRegistry;
        this.coreToolCatalog = coreToolCatalog;
        this.discoveryService = discoveryService;
        this.schemaResolver = schemaResolver;
        this.toolDispatcher = toolDispatcher;
    }

    /**
     * {@inheritDoc}
     * The live catalog is read once per operation, so an operation never spans two catalog versions.
     */
    @Override
    public ToolOperationResult handle(ToolOperation operation) {
        CatalogIndex index = catalogRegistry.current();

        if (operation instanceof ToolOperation.Discover discover) {
            DiscoveryResult result = discoveryService.discover(index, discover.query());
            return new ToolOperationResult.Discovered(result);
        }
        if (operation instanceof ToolOperation.Resolve resolve) {
            ToolDescriptor descriptor = coreToolCatalog.metaTool(resolve.toolName())
                    .orElseGet(() -> schemaResolver.resolve(index, resolve.toolName()));
            return new ToolOperationResult.Resolved(descriptor, schemaResolver.inputSchema(descriptor));
        }
        if (operation instanceof ToolOperation.Dispatch dispatch) {
            JsonNode payload = toolDispatcher.dispatch(index, dispatch.invocation());
            return new ToolOperationResult.Dispatched(dispatch.invocation().toolName(), payload);
        }
        throw new IllegalStateException("Unsupported operation: " + operation);
    }

    @Override
    public ToolOperationResult call(String toolName, Map<String, Object> arguments) {
        Map<String, Object> args = arguments == null ? Collections.emptyMap() : arguments;
        log.debug("Tool call '{}' with arguments {}", toolName, args.keySet());

        if (CoreToolCatalog.DISCOVER_TOOLS.equals(toolName)) {
            rejectUnknown(toolName, args, DISCOVER_ARGUMENTS);
            return handle(new ToolOperation.Discover(new DiscoveryQuery(
                    text(args.get("category")),
                    text(args.get("keyword")),
                    maxResults(args.get("max_results")))));
        }
        if (CoreToolCatalog.GET_TOOL_SCHEMA.equals(toolName)) {
            rejectUnknown(toolName, args, SCHEMA_ARGUMENTS);
            String target = text(args.get("tool_name"));
            if (target == null || target.isBlank()) {
                throw ArgumentValidationException.missing(toolName, "tool_name");
            }
            return handle(new ToolOperation.Resolve(target.trim()));
        }
        return handle(new ToolOperation.Dispatch(new Invocation(toolName, args)));
    }

    private static void rejectUnknown(String toolName, Map<String, Object> args, Set<String> accepted) {
        List<String> unknown = new ArrayList<>(new TreeSet<>(args.keySet()));
        unknown.removeAll(accepted);
        if (!unknown.isEmpty()) {
            throw new ArgumentValidationException(toolName, List.of(), unknown, Map.of());
        }
    }

    private static String text(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    /**
     * Reads {@code max_results} as a whole number. Values beyond the {@code int} range saturate, so the discovery
     * engine clamps them to its ceiling like any other oversized request.
     */
    private static Integer maxResults(Object value) {
        if (value == null) {
            return null;
        }
        BigDecimal number;
        try {
            number = new BigDecimal(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw ArgumentValidationException.invalid(CoreToolCatalog.DISCOVER_TOOLS, "max_results",
                    "expected an integer but got '" + value + "'");
        }
        if (number.stripTrailingZeros().scale() > 0) {
            throw ArgumentValidationException.invalid(CoreToolCatalog.DISCOVER_TOOLS, "max_results",
                    "expected an integer but got '" + value + "'");
        }
        return number.max(INT_MIN).min(INT_MAX).intValue();
    }
}

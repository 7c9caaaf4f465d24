package com.sonarrmcp.config;

import com.sonarrmcp.exception.SchemaException;
import com.sonarrmcp.model.CatalogIndex;
import com.sonarrmcp.service.api.CatalogRegistry;
import com.sonarrmcp.service.api.CoreToolCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Builds the tool catalog from the configured OpenAPI document when the application starts.
 * <p>
 * A document that cannot be loaded or indexed aborts startup with a {@link SchemaException}; the gateway has
 * nothing to offer without a catalog.
 */
@Slf4j
@Component
@Profile("!test") // Ensures this does not run during tests
public class CatalogBootstrapRunner implements CommandLineRunner {

    private final GatewayProperties properties;
    private final CatalogRegistry catalogRegistry;
    private final CoreToolCatalog coreToolCatalog;

    public CatalogBootstrapRunner(GatewayProperties properties, CatalogRegistry catalogRegistry,
                                  CoreToolCatalog coreToolCatalog) {
        this.properties = properties;
        this.catalogRegistry = catalogRegistry;
        this.coreToolCatalog = coreToolCatalog;
    }

    @Override
    public void run(String... args) {
        String location = properties.getOpenapiLocation();
        if (location == null || location.isBlank()) {
            throw new SchemaException("No OpenAPI document configured. Set mcp.openapi-location (SONARR_OPENAPI_LOCATION).");
        }

        log.info("--- Building tool catalog from {} ---", location);
        CatalogIndex index = catalogRegistry.reload(location);
        log.info("Catalog ready: {} tools in {} categories. Core tools: {}",
                index.size(), index.tagCounts().size(), coreToolCatalog.coreTools(index));

        properties.getCoreTools().getNames().stream()
                .filter(name -> !index.contains(name))
                .forEach(name -> log.warn("Configured core tool '{}' is not in the catalog and will not be shown.", name));
    }
}

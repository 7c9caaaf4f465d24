package com.sonarrmcp.service.api;

import com.sonarrmcp.model.CatalogIndex;
import io.swagger.v3.oas.models.OpenAPI;

/**
 * Turns an OpenAPI document into a {@link CatalogIndex}.
 */
public interface SchemaIndexService {

    /**
     * Loads an OpenAPI document (JSON or YAML) from a URL or local file path and indexes it.
     *
     * @param location The URL or local file path of the document.
     * @return The new catalog.
     * @throws com.sonarrmcp.exception.SchemaException if the document cannot be read or indexed.
     */
    CatalogIndex load(String location);

    /**
     * Parses an OpenAPI document given as text and indexes it.
     *
     * @param content The JSON or YAML document.
     * @return The new catalog.
     * @throws com.sonarrmcp.exception.SchemaException if the document cannot be parsed or indexed.
     */
    CatalogIndex parse(String content);

    /**
     * Indexes an already parsed document. Schema references are expanded inline, up to a bounded depth.
     *
     * @param openAPI The parsed document, with references left unresolved.
     * @return The new catalog.
     * @throws com.sonarrmcp.exception.SchemaException if the document has no paths or a reference cannot be resolved.
     */
    CatalogIndex build(OpenAPI openAPI);
}

package com.sonarrmcp.service.api;

import com.sonarrmcp.model.CatalogIndex;
import java.util.Optional;

/**
 * Holds the live catalog. The catalog is only ever replaced as a whole, never changed in place, so readers
 * always observe a complete index.
 */
public interface CatalogRegistry {

    /**
     * @return The live catalog.
     * @throws com.sonarrmcp.exception.CatalogUnavailableException if no catalog has been loaded.
     */
    CatalogIndex current();

    Optional<CatalogIndex> snapshot();

    /**
     * Builds a catalog from the document at the given location and makes it live. If the build fails the
     * previous catalog stays live.
     *
     * @param location The URL or file path of the OpenAPI document.
     * @return The new live catalog.
     */
    CatalogIndex reload(String location);

    /**
     * Makes an already built catalog live.
     */
    void replace(CatalogIndex index);
}

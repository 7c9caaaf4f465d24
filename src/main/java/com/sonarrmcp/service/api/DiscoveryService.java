package com.sonarrmcp.service.api;

import com.sonarrmcp.model.CatalogIndex;
import com.sonarrmcp.model.DiscoveryQuery;
import com.sonarrmcp.model.DiscoveryResult;

public interface DiscoveryService {

    /**
     * Finds the tools matching a query, ranked and bounded.
     * <p>
     * A query without category, keyword and limit returns only the core tool set; the full catalog is never
     * handed over unless the caller asks for it with an explicit limit.
     *
     * @param index The catalog to search.
     * @param query The filters and limit.
     * @return The ranked matches; empty when nothing matches.
     */
    DiscoveryResult discover(CatalogIndex index, DiscoveryQuery query);
}

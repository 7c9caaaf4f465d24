package com.sonarrmcp.service.impl;

import com.sonarrmcp.exception.CatalogUnavailableException;
import com.sonarrmcp.model.CatalogIndex;
import com.sonarrmcp.service.api.CatalogRegistry;
import com.sonarrmcp.service.api.SchemaIndexService;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Keeps the live catalog behind an {@link AtomicReference}. Readers take a snapshot and keep using it for the
 * whole operation, so a concurrent reload never shows them a half-built index.
 */
@Service
@Slf4j
public class CatalogRegistryImpl implements CatalogRegistry {

    private final SchemaIndexService schemaIndexService;
    private final AtomicReference<CatalogIndex> current = new AtomicReference<>();

    public CatalogRegistryImpl(SchemaIndexService schemaIndexService) {
        this.schemaIndexService = schemaIndexService;
    }

    @Override
    public CatalogIndex current() {
        CatalogIndex index = current.get();
        if (index == null) {
            throw new CatalogUnavailableException();
        }
        return index;
    }

    @Override
    public Optional<CatalogIndex> snapshot() {
        return Optional.ofNullable(current.get());
    }

    @Override
    public CatalogIndex reload(String location) {
        // Built before the swap: a failing document leaves the previous catalog live.
        CatalogIndex index = schemaIndexService.load(location);
        replace(index);
        return index;
    }

    @Override
    public void replace(CatalogIndex index) {
        CatalogIndex previous = current.getAndSet(Objects.requireNonNull(index, "index"));
        if (previous != null) {
            log.info("Catalog replaced: {} tools -> {} tools.", previous.size(), index.size());
        }
    }
}

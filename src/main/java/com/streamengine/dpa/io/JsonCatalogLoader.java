package com.streamengine.dpa.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamengine.dpa.catalog.InMemoryParameterCatalog;
import com.streamengine.dpa.catalog.Parameter;
import com.streamengine.dpa.catalog.ParameterKind;
import com.streamengine.dpa.catalog.Stream;
import com.streamengine.dpa.catalog.ValueEncoding;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Builds an {@link InMemoryParameterCatalog} from a JSON catalog document.
 *
 * Referential integrity (inputs and stream members must exist) is checked
 * here. Cycles are not: they surface as
 * {@link com.streamengine.dpa.api.CatalogCycleException} when a request
 * reaches them, leaving the rest of the catalog usable.
 */
public final class JsonCatalogLoader {
    private static final Logger log = LogManager.getLogger(JsonCatalogLoader.class);

    private final ObjectMapper mapper = new ObjectMapper();

    public InMemoryParameterCatalog loadResource(String resource) {
        try (InputStream in = JsonCatalogLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Catalog resource not found: " + resource);
            return compile(mapper.readValue(in, CatalogDefinition.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load catalog from " + resource, e);
        }
    }

    public InMemoryParameterCatalog parse(String json) {
        try {
            return compile(mapper.readValue(json, CatalogDefinition.class));
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid catalog document", e);
        }
    }

    public InMemoryParameterCatalog compile(CatalogDefinition definition) {
        CatalogDefinition.CatalogInfo info = definition.getCatalog();
        if (info == null)
            throw new IllegalArgumentException("Missing 'catalog' key");

        InMemoryParameterCatalog.Builder builder = InMemoryParameterCatalog.builder();
        if (info.getParameters() != null) {
            for (CatalogDefinition.ParameterDef def : info.getParameters()) {
                builder.addParameter(new Parameter(def.getId(), def.getName(),
                        ParameterKind.fromString(def.getType()),
                        ValueEncoding.fromString(def.getEncoding()),
                        def.getInputs(), def.getCoefficients(), def.getFunction()));
            }
        }
        if (info.getStreams() != null) {
            for (CatalogDefinition.StreamDef def : info.getStreams())
                builder.addStream(new Stream(def.getName(), def.getParameters()));
        }
        InMemoryParameterCatalog catalog = builder.build();
        log.info("Loaded catalog {} {}: {} parameters, {} streams", info.getName(), info.getVersion(),
                catalog.parameters().size(), catalog.streams().size());
        return catalog;
    }
}

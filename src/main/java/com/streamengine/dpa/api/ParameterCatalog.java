package com.streamengine.dpa.api;

import com.streamengine.dpa.catalog.Parameter;
import com.streamengine.dpa.catalog.Stream;

/**
 * Read-only view of the parameter/stream metadata registry.
 *
 * Implementations must be safe for concurrent readers; the engine shares one
 * catalog across all requests.
 */
public interface ParameterCatalog {

    /**
     * @param id catalog id
     * @return the parameter
     * @throws IllegalArgumentException if the id is unknown
     */
    Parameter lookup(int id);

    /**
     * @param name stream name
     * @return the stream
     * @throws IllegalArgumentException if the stream is unknown
     */
    Stream lookupStream(String name);

    /** @return true if the id is present in the catalog. */
    boolean contains(int id);
}

package com.streamengine.dpa.api;

import java.util.List;

/**
 * The catalog's dependency graph contains a cycle. This is corrupt metadata,
 * not a transient condition: the request is aborted and never retried.
 */
public class CatalogCycleException extends DataProductException {
    private final List<Integer> cycle;

    public CatalogCycleException(List<Integer> cycle) {
        super("Cycle detected in parameter dependencies: " + cycle);
        this.cycle = List.copyOf(cycle);
    }

    /** Parameter ids along the cycle, first id repeated at the end. */
    public List<Integer> cycle() {
        return cycle;
    }
}

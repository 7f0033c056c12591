package com.streamengine.dpa.engine;

import com.streamengine.dpa.api.CatalogCycleException;
import com.streamengine.dpa.api.ParameterCatalog;
import com.streamengine.dpa.catalog.Parameter;
import com.streamengine.dpa.instance.ParameterInstance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import lombok.extern.log4j.Log4j2;

/**
 * Computes dependency closures over the catalog's parameter graph.
 *
 * Algorithm:
 * Depth-first over declared inputs. A parameter is appended to the closure
 * once all of its inputs have been, so a closure always lists inputs before
 * the parameters that consume them and ends with the target itself. Ids
 * already in the closure are skipped, which handles shared ancestors. An id
 * met again while still on the DFS path is a cycle and aborts the request
 * with {@link CatalogCycleException}.
 *
 * Closures are memoized per resolver; one resolver is meant to live as long
 * as the catalog it reads, and may be shared between request threads.
 */
@Log4j2
public final class DependencyResolver {
    private final ParameterCatalog catalog;
    private final Map<Integer, List<Parameter>> closures = new ConcurrentHashMap<>();
    private final Map<Integer, Set<String>> coefficientClosures = new ConcurrentHashMap<>();

    public DependencyResolver(ParameterCatalog catalog) {
        this.catalog = catalog;
    }

    public ParameterCatalog catalog() {
        return catalog;
    }

    /**
     * Transitive closure of {@code target} over declared inputs, including
     * the target itself, without duplicates.
     *
     * @throws CatalogCycleException if the declared inputs loop back
     */
    public List<Parameter> needs(Parameter target) {
        List<Parameter> cached = closures.get(target.id());
        if (cached != null)
            return cached;

        Map<Integer, Parameter> visited = new LinkedHashMap<>();
        visit(target, visited, new LinkedHashSet<>());
        List<Parameter> closure = Collections.unmodifiableList(new ArrayList<>(visited.values()));
        List<Parameter> prev = closures.putIfAbsent(target.id(), closure);
        return prev != null ? prev : closure;
    }

    public List<Parameter> needs(int id) {
        return needs(catalog.lookup(id));
    }

    /** Calibration coefficient names required anywhere in the closure. */
    public Set<String> needsCoefficients(Parameter target) {
        Set<String> cached = coefficientClosures.get(target.id());
        if (cached != null)
            return cached;

        Set<String> names = new LinkedHashSet<>();
        for (Parameter p : needs(target))
            names.addAll(p.coefficients());
        Set<String> result = Collections.unmodifiableSet(names);
        Set<String> prev = coefficientClosures.putIfAbsent(target.id(), result);
        return prev != null ? prev : result;
    }

    private void visit(Parameter p, Map<Integer, Parameter> visited, LinkedHashSet<Integer> path) {
        if (visited.containsKey(p.id()))
            return;
        if (!path.add(p.id())) {
            List<Integer> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (int id : path) {
                if (id == p.id())
                    inCycle = true;
                if (inCycle)
                    cycle.add(id);
            }
            cycle.add(p.id());
            log.error("Catalog dependency cycle: {}", cycle);
            throw new CatalogCycleException(cycle);
        }
        for (int inputId : p.inputs())
            visit(catalog.lookup(inputId), visited, path);
        path.remove(p.id());
        visited.put(p.id(), p);
    }

    /**
     * Registers the closure of every requested parameter in the request's
     * working set. Ids already present are left alone, so populating twice, or
     * populating overlapping targets, is harmless.
     */
    public void populate(StreamRequest request, List<Parameter> requested) {
        int added = 0;
        for (Parameter target : requested) {
            for (Parameter p : needs(target)) {
                if (request.register(ParameterInstance.create(p, request.key())))
                    added++;
            }
            request.requireCoefficients(needsCoefficients(target));
            request.addRequested(target.id());
        }
        log.debug("Resolved {} targets into {} new instances for {}", requested.size(), added, request.key());
    }
}

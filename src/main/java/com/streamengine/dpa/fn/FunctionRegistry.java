package com.streamengine.dpa.fn;

import com.streamengine.dpa.api.DataProductFunction;
import com.streamengine.dpa.fn.ctd.CtdFunctions;
import com.streamengine.dpa.fn.generic.GenericFunctions;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-addressed library of transformation functions.
 *
 * The catalog names a function for every derived parameter; the executor
 * resolves that name here. Registration is expected at startup, lookups are
 * safe from any request thread.
 */
public final class FunctionRegistry {
    private final Map<String, DataProductFunction> registry = new ConcurrentHashMap<>();

    /** A registry pre-loaded with the built-in functions. */
    public FunctionRegistry() {
        registerBuiltIns();
    }

    private FunctionRegistry(boolean builtIns) {
        if (builtIns)
            registerBuiltIns();
    }

    /** A registry with nothing registered. */
    public static FunctionRegistry empty() {
        return new FunctionRegistry(false);
    }

    public FunctionRegistry register(String name, DataProductFunction function) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Function name must not be blank");
        registry.put(name, function);
        return this;
    }

    /** The function registered under a name, or null. */
    public DataProductFunction lookup(String name) {
        return name == null ? null : registry.get(name);
    }

    public boolean contains(String name) {
        return name != null && registry.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(registry.keySet()));
    }

    // ── Built-in Functions ─────────────────────────────────────────

    private void registerBuiltIns() {
        // --- CTD ---
        register("ctd_sbe52mp_preswat", CtdFunctions.PRESWAT);
        register("ctd_sbe52mp_tempwat", CtdFunctions.TEMPWAT);
        register("ctd_sbe52mp_condwat", CtdFunctions.CONDWAT);
        register("ctd_sbe16plus_tempwat", CtdFunctions.SBE16PLUS_TEMPWAT);
        register("ctd_pracsal", CtdFunctions.PRACSAL);
        register("ctd_density", CtdFunctions.DENSITY);

        // --- Generic ---
        register("polyval", GenericFunctions.POLYVAL);
        register("linear_scale", GenericFunctions.LINEAR_SCALE);
        register("difference", GenericFunctions.DIFFERENCE);
        register("mean", GenericFunctions.MEAN);
    }
}

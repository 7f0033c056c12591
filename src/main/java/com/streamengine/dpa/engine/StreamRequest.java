package com.streamengine.dpa.engine;

import com.streamengine.dpa.api.StreamKey;
import com.streamengine.dpa.instance.CalibrationCoefficient;
import com.streamengine.dpa.instance.DataParameterInstance;
import com.streamengine.dpa.instance.FunctionParameterInstance;
import com.streamengine.dpa.instance.ParameterInstance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The working set of one data-product request.
 *
 * Holds one live instance per parameter id, the calibration coefficients
 * bound for the request and the ids the caller wants back. Everything is
 * kept in insertion order: the aligner picks its reference series and the
 * executor walks function instances in that order, which keeps results
 * reproducible for identical inputs.
 *
 * Thread Safety:
 * Built and mutated by exactly one thread per request. Not thread-safe.
 */
public final class StreamRequest {
    private final StreamKey key;
    private final Map<Integer, ParameterInstance> instances = new LinkedHashMap<>();
    private final Map<String, CalibrationCoefficient> coefficients = new LinkedHashMap<>();
    private final Set<Integer> requested = new LinkedHashSet<>();
    private final Set<String> requiredCoefficients = new LinkedHashSet<>();

    public StreamRequest(StreamKey key) {
        this.key = Objects.requireNonNull(key, "key");
    }

    public StreamKey key() {
        return key;
    }

    /**
     * Adds an instance unless one with the same id is already present.
     *
     * @return true if the instance was added
     */
    public boolean register(ParameterInstance instance) {
        return instances.putIfAbsent(instance.id(), instance) == null;
    }

    public boolean contains(int id) {
        return instances.containsKey(id);
    }

    /** The instance for an id, or null. */
    public ParameterInstance instance(int id) {
        return instances.get(id);
    }

    /** Read-only id to instance view, in registration order. */
    public Map<Integer, ParameterInstance> dataMap() {
        return Collections.unmodifiableMap(instances);
    }

    public List<DataParameterInstance> dataInstances() {
        List<DataParameterInstance> out = new ArrayList<>();
        for (ParameterInstance pi : instances.values())
            if (pi instanceof DataParameterInstance dp)
                out.add(dp);
        return out;
    }

    public List<FunctionParameterInstance> functionInstances() {
        List<FunctionParameterInstance> out = new ArrayList<>();
        for (ParameterInstance pi : instances.values())
            if (pi instanceof FunctionParameterInstance fp)
                out.add(fp);
        return out;
    }

    /**
     * Binds a calibration coefficient. Bindings are immutable: binding the
     * same name twice is an error.
     */
    public void addCoefficient(CalibrationCoefficient coefficient) {
        if (coefficients.putIfAbsent(coefficient.name(), coefficient) != null)
            throw new IllegalArgumentException("Coefficient already bound: " + coefficient.name());
    }

    public CalibrationCoefficient coefficient(String name) {
        return coefficients.get(name);
    }

    public Map<String, CalibrationCoefficient> coefficients() {
        return Collections.unmodifiableMap(coefficients);
    }

    public void addRequested(int id) {
        requested.add(id);
    }

    public Set<Integer> requested() {
        return Collections.unmodifiableSet(requested);
    }

    /** Instances the caller asked for, in request order; ids never registered are skipped. */
    public List<ParameterInstance> requestedInstances() {
        List<ParameterInstance> out = new ArrayList<>(requested.size());
        for (int id : requested) {
            ParameterInstance pi = instances.get(id);
            if (pi != null)
                out.add(pi);
        }
        return out;
    }

    public void requireCoefficients(Iterable<String> names) {
        for (String name : names)
            requiredCoefficients.add(name);
    }

    /** Coefficient names demanded by the resolved closure. */
    public Set<String> requiredCoefficients() {
        return Collections.unmodifiableSet(requiredCoefficients);
    }

    /** Required coefficient names with no binding yet. */
    public Set<String> missingCoefficients() {
        Set<String> missing = new LinkedHashSet<>(requiredCoefficients);
        missing.removeAll(coefficients.keySet());
        return missing;
    }

    /**
     * Folds another request into this one so that cross-stream products can be
     * computed on a shared clock. Existing instances and coefficient bindings
     * win; the other request's entries are appended after ours.
     */
    public StreamRequest merge(StreamRequest other) {
        for (ParameterInstance pi : other.instances.values())
            instances.putIfAbsent(pi.id(), pi);
        for (CalibrationCoefficient cc : other.coefficients.values())
            coefficients.putIfAbsent(cc.name(), cc);
        requested.addAll(other.requested);
        requiredCoefficients.addAll(other.requiredCoefficients);
        return this;
    }

    @Override
    public String toString() {
        return "StreamRequest[" + key + ", " + instances.size() + " instances, "
                + coefficients.size() + " coefficients, requested=" + requested + "]";
    }
}

package com.streamengine.dpa.api;

import com.streamengine.dpa.array.NdArray;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named arguments for one transformation function call.
 *
 * Positional inputs are named {@code p0, p1, ...} in declared order and bound
 * to arrays; calibration coefficients keep their catalog names and are bound
 * to a {@link Double} (scalar) or a {@code double[]} (vector).
 */
public final class FunctionArguments {
    private final Map<String, Object> values;
    private final int positionalCount;
    private final List<String> coefficientNames;

    private FunctionArguments(Map<String, Object> values, int positionalCount, List<String> coefficientNames) {
        this.values = Collections.unmodifiableMap(values);
        this.positionalCount = positionalCount;
        this.coefficientNames = List.copyOf(coefficientNames);
    }

    public static String positionalName(int index) {
        return "p" + index;
    }

    /** True for names of the {@code p<index>} form reserved for positional inputs. */
    public static boolean isPositionalName(String name) {
        return name != null && name.matches("p\\d+");
    }

    /** All arguments by name, positional ones first. */
    public Map<String, Object> asMap() {
        return values;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public int positionalCount() {
        return positionalCount;
    }

    /** Positional input {@code p<index>}. */
    public NdArray array(int index) {
        if (index < 0 || index >= positionalCount)
            throw new IndexOutOfBoundsException("No positional argument p" + index + " (have " + positionalCount + ")");
        return (NdArray) values.get(positionalName(index));
    }

    /** Declared coefficient names, in declared order. */
    public List<String> coefficientNames() {
        return coefficientNames;
    }

    public double scalar(String name) {
        Object v = require(name);
        if (v instanceof Double d)
            return d;
        if (v instanceof double[] arr && arr.length == 1)
            return arr[0];
        throw new IllegalArgumentException("Argument " + name + " is not a scalar");
    }

    public double[] vector(String name) {
        Object v = require(name);
        if (v instanceof double[] arr)
            return arr.clone();
        if (v instanceof Double d)
            return new double[] { d };
        throw new IllegalArgumentException("Argument " + name + " is not a coefficient");
    }

    /** The i-th declared coefficient as a vector, for functions generic over coefficient names. */
    public double[] coefficientAt(int index) {
        return vector(coefficientNames.get(index));
    }

    private Object require(String name) {
        Object v = values.get(name);
        if (v == null)
            throw new IllegalArgumentException("Missing argument: " + name);
        return v;
    }

    @Override
    public String toString() {
        return "FunctionArguments" + values.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();
        private final List<String> coefficientNames = new ArrayList<>();
        private int positionalCount;

        /** Appends the next positional input. */
        public Builder positional(NdArray array) {
            values.put(positionalName(positionalCount++), array);
            return this;
        }

        /**
         * @throws IllegalArgumentException if the name is reserved for a
         *                                  positional input
         */
        public Builder coefficient(String name, Object value) {
            if (isPositionalName(name))
                throw new IllegalArgumentException("Coefficient name " + name + " collides with a positional input");
            if (values.put(name, value) == null)
                coefficientNames.add(name);
            return this;
        }

        public FunctionArguments build() {
            return new FunctionArguments(new LinkedHashMap<>(values), positionalCount, coefficientNames);
        }
    }
}

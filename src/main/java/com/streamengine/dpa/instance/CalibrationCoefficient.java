package com.streamengine.dpa.instance;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A per-instrument constant supplied with the request: either a scalar or a
 * short fixed-length vector (polynomial terms, for example).
 */
public final class CalibrationCoefficient {
    private final String subsite;
    private final String node;
    private final String sensor;
    private final String name;
    private final double[] values;
    private final boolean scalar;

    private CalibrationCoefficient(String subsite, String node, String sensor, String name,
            double[] values, boolean scalar) {
        this.subsite = subsite;
        this.node = node;
        this.sensor = sensor;
        this.name = Objects.requireNonNull(name, "name");
        this.values = values;
        this.scalar = scalar;
    }

    public static CalibrationCoefficient scalar(String subsite, String node, String sensor, String name,
            double value) {
        return new CalibrationCoefficient(subsite, node, sensor, name, new double[] { value }, true);
    }

    public static CalibrationCoefficient vector(String subsite, String node, String sensor, String name,
            double[] values) {
        return new CalibrationCoefficient(subsite, node, sensor, name, values.clone(), false);
    }

    /**
     * Binds a loosely typed request value: a {@link Number}, a
     * {@code double[]} or a list of numbers.
     */
    public static CalibrationCoefficient of(String subsite, String node, String sensor, String name,
            Object value) {
        if (value instanceof Number n)
            return scalar(subsite, node, sensor, name, n.doubleValue());
        if (value instanceof double[] arr)
            return vector(subsite, node, sensor, name, arr);
        if (value instanceof List<?> list) {
            double[] arr = new double[list.size()];
            for (int i = 0; i < arr.length; i++) {
                if (!(list.get(i) instanceof Number n))
                    throw new IllegalArgumentException("Coefficient " + name + " has non-numeric element " + list.get(i));
                arr[i] = n.doubleValue();
            }
            return vector(subsite, node, sensor, name, arr);
        }
        throw new IllegalArgumentException("Unsupported value for coefficient " + name + ": " + value);
    }

    public String subsite() {
        return subsite;
    }

    public String node() {
        return node;
    }

    public String sensor() {
        return sensor;
    }

    public String name() {
        return name;
    }

    /**
     * The value passed to transformation functions: a {@link Double} for
     * scalars, a fresh {@code double[]} copy for vectors.
     */
    public Object value() {
        return scalar ? Double.valueOf(values[0]) : values.clone();
    }

    public double[] vectorValue() {
        return values.clone();
    }

    @Override
    public String toString() {
        return name + "=" + (scalar ? Double.toString(values[0]) : Arrays.toString(values));
    }
}

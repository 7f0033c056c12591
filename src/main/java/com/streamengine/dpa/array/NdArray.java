package com.streamengine.dpa.array;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable n-dimensional array with a leading time axis.
 *
 * Storage is a single flat row-major array whose Java type depends on the
 * {@link DType}: {@code long[]} for integer types, {@code double[]} for
 * floating point types and {@code String[]} for text. Row {@code r} of an
 * array with shape {@code [n, c1, c2]} occupies the flat range
 * {@code [r * c1 * c2, (r + 1) * c1 * c2)}.
 *
 * Equality is bit-for-bit on the stored values, plus dtype and shape.
 */
public final class NdArray {
    private final DType dtype;
    private final int[] shape;
    private final int size;

    // exactly one of these is non-null, matching dtype.storage()
    private final long[] longs;
    private final double[] doubles;
    private final String[] strings;

    private NdArray(DType dtype, int[] shape, long[] longs, double[] doubles, String[] strings) {
        if (shape.length == 0)
            throw new IllegalArgumentException("NdArray needs at least one dimension");
        int n = 1;
        for (int d : shape) {
            if (d < 0)
                throw new IllegalArgumentException("Negative dimension in shape " + Arrays.toString(shape));
            n *= d;
        }
        int actual = longs != null ? longs.length : doubles != null ? doubles.length : strings.length;
        if (n != actual)
            throw new IllegalArgumentException(
                    "Shape " + Arrays.toString(shape) + " needs " + n + " values but got length " + actual);
        this.dtype = dtype;
        this.shape = shape;
        this.size = n;
        this.longs = longs;
        this.doubles = doubles;
        this.strings = strings;
    }

    // ── Factories ──────────────────────────────────────────────────

    /** 1-D float64 array. */
    public static NdArray of(double... values) {
        return ofDoubles(DType.FLOAT64, values.clone());
    }

    /** 1-D int64 array. */
    public static NdArray ofLongs(long... values) {
        return ofLongs(DType.INT64, values.clone());
    }

    /** 1-D text array. */
    public static NdArray ofStrings(String... values) {
        return ofStrings(values.clone(), values.length);
    }

    /**
     * Wraps a flat row-major buffer. The buffer is owned by the array from here
     * on; callers must not mutate it afterwards. An empty shape means 1-D.
     */
    public static NdArray ofDoubles(DType dtype, double[] flat, int... shape) {
        if (dtype.storage() != DType.Storage.DOUBLE)
            throw new IllegalArgumentException(dtype + " is not a floating point type");
        return new NdArray(dtype, shapeOrVector(shape, flat.length), null, flat, null);
    }

    public static NdArray ofLongs(DType dtype, long[] flat, int... shape) {
        if (dtype.storage() != DType.Storage.LONG)
            throw new IllegalArgumentException(dtype + " is not an integer type");
        return new NdArray(dtype, shapeOrVector(shape, flat.length), flat, null, null);
    }

    public static NdArray ofStrings(String[] flat, int... shape) {
        return new NdArray(DType.STRING, shapeOrVector(shape, flat.length), null, null, flat);
    }

    public static NdArray ofText(DType dtype, String[] flat, int... shape) {
        if (dtype.storage() != DType.Storage.TEXT)
            throw new IllegalArgumentException(dtype + " is not a text type");
        return new NdArray(dtype, shapeOrVector(shape, flat.length), null, null, flat);
    }

    /** Row-major 2-D float64 array from nested rows of equal width. */
    public static NdArray ofRows(double[][] rows) {
        int width = rows.length == 0 ? 0 : rows[0].length;
        double[] flat = new double[rows.length * width];
        for (int r = 0; r < rows.length; r++) {
            if (rows[r].length != width)
                throw new IllegalArgumentException("Ragged row " + r + ": expected width " + width);
            System.arraycopy(rows[r], 0, flat, r * width, width);
        }
        return ofDoubles(DType.FLOAT64, flat, rows.length, width);
    }

    private static int[] shapeOrVector(int[] shape, int length) {
        return shape == null || shape.length == 0 ? new int[] { length } : shape.clone();
    }

    // ── Shape ──────────────────────────────────────────────────────

    public DType dtype() {
        return dtype;
    }

    public int[] shape() {
        return shape.clone();
    }

    public int ndim() {
        return shape.length;
    }

    /** Number of rows along the leading (time) axis. */
    public int length() {
        return shape[0];
    }

    /** Total number of elements. */
    public int size() {
        return size;
    }

    /** Number of elements per leading-axis row (product of trailing axes). */
    public int rowWidth() {
        int w = 1;
        for (int i = 1; i < shape.length; i++)
            w *= shape[i];
        return w;
    }

    public boolean isNumeric() {
        return dtype.isNumeric();
    }

    /**
     * The dtype tag describing the in-memory representation. Text arrays report
     * their longest element, numpy style.
     */
    public String dtypeTag() {
        if (dtype != DType.STRING)
            return dtype.tag();
        int max = 1;
        for (String s : strings)
            if (s != null && s.length() > max)
                max = s.length();
        return dtype.tag() + max;
    }

    // ── Element access ─────────────────────────────────────────────

    public double getDouble(int flatIndex) {
        return switch (dtype.storage()) {
            case DOUBLE -> doubles[flatIndex];
            case LONG -> longs[flatIndex];
            case TEXT -> throw new UnsupportedOperationException("Text array has no numeric values");
        };
    }

    public double getDouble(int row, int column) {
        return getDouble(row * rowWidth() + column);
    }

    public long getLong(int flatIndex) {
        return switch (dtype.storage()) {
            case LONG -> longs[flatIndex];
            case DOUBLE -> (long) doubles[flatIndex];
            case TEXT -> throw new UnsupportedOperationException("Text array has no numeric values");
        };
    }

    public String getString(int flatIndex) {
        return switch (dtype.storage()) {
            case TEXT -> strings[flatIndex];
            case LONG -> Long.toString(longs[flatIndex]);
            case DOUBLE -> Double.toString(doubles[flatIndex]);
        };
    }

    /** Boxed element, used by serializers. */
    public Object get(int flatIndex) {
        return switch (dtype.storage()) {
            case LONG -> longs[flatIndex];
            case DOUBLE -> doubles[flatIndex];
            case TEXT -> strings[flatIndex];
        };
    }

    /** Copy of the values widened to double. */
    public double[] toDoubleArray() {
        if (doubles != null)
            return doubles.clone();
        double[] out = new double[size];
        for (int i = 0; i < size; i++)
            out[i] = getDouble(i);
        return out;
    }

    public long[] toLongArray() {
        if (longs != null)
            return longs.clone();
        long[] out = new long[size];
        for (int i = 0; i < size; i++)
            out[i] = getLong(i);
        return out;
    }

    public String[] toStringArray() {
        if (strings != null)
            return strings.clone();
        String[] out = new String[size];
        for (int i = 0; i < size; i++)
            out[i] = getString(i);
        return out;
    }

    /**
     * Builds a new array from the given leading-axis rows (repeats allowed),
     * keeping dtype and trailing shape.
     */
    public NdArray selectRows(int[] rows) {
        int width = rowWidth();
        int[] newShape = shape.clone();
        newShape[0] = rows.length;
        switch (dtype.storage()) {
            case LONG -> {
                long[] out = new long[rows.length * width];
                for (int i = 0; i < rows.length; i++)
                    System.arraycopy(longs, rows[i] * width, out, i * width, width);
                return new NdArray(dtype, newShape, out, null, null);
            }
            case DOUBLE -> {
                double[] out = new double[rows.length * width];
                for (int i = 0; i < rows.length; i++)
                    System.arraycopy(doubles, rows[i] * width, out, i * width, width);
                return new NdArray(dtype, newShape, null, out, null);
            }
            default -> {
                String[] out = new String[rows.length * width];
                for (int i = 0; i < rows.length; i++)
                    System.arraycopy(strings, rows[i] * width, out, i * width, width);
                return new NdArray(dtype, newShape, null, null, out);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NdArray other))
            return false;
        return dtype == other.dtype
                && Arrays.equals(shape, other.shape)
                && Arrays.equals(longs, other.longs)
                && Arrays.equals(doubles, other.doubles)
                && Arrays.equals(strings, other.strings);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(dtype, Arrays.hashCode(shape));
        h = 31 * h + Arrays.hashCode(longs);
        h = 31 * h + Arrays.hashCode(doubles);
        return 31 * h + Arrays.hashCode(strings);
    }

    @Override
    public String toString() {
        String values = switch (dtype.storage()) {
            case LONG -> Arrays.toString(size > 16 ? Arrays.copyOf(longs, 16) : longs);
            case DOUBLE -> Arrays.toString(size > 16 ? Arrays.copyOf(doubles, 16) : doubles);
            case TEXT -> Arrays.toString(size > 16 ? Arrays.copyOf(strings, 16) : strings);
        };
        return "NdArray[" + dtypeTag() + " " + Arrays.toString(shape) + " " + values
                + (size > 16 ? "..." : "") + "]";
    }
}

package com.streamengine.dpa.fn;

import com.streamengine.dpa.api.DataProductFunction;
import com.streamengine.dpa.array.DType;
import com.streamengine.dpa.array.NdArray;

/**
 * Lifts scalar kernels to array functions over the positional inputs.
 *
 * The output has the shape of {@code p0} and dtype float64. All positional
 * inputs must hold the same number of elements; integer inputs are widened
 * to double before the kernel sees them.
 */
public final class Elementwise {
    private Elementwise() {
        // Utility class
    }

    public static DataProductFunction unary(Fn1 fn) {
        return args -> map1(args.array(0), fn);
    }

    public static DataProductFunction binary(Fn2 fn) {
        return args -> map2(args.array(0), args.array(1), fn);
    }

    public static DataProductFunction ternary(Fn3 fn) {
        return args -> map3(args.array(0), args.array(1), args.array(2), fn);
    }

    public static NdArray map1(NdArray a, Fn1 fn) {
        requireNumeric(a);
        double[] out = new double[a.size()];
        for (int i = 0; i < out.length; i++)
            out[i] = fn.apply(a.getDouble(i));
        return NdArray.ofDoubles(DType.FLOAT64, out, a.shape());
    }

    public static NdArray map2(NdArray a, NdArray b, Fn2 fn) {
        requireNumeric(a);
        requireCompatible(a, b);
        double[] out = new double[a.size()];
        for (int i = 0; i < out.length; i++)
            out[i] = fn.apply(a.getDouble(i), b.getDouble(i));
        return NdArray.ofDoubles(DType.FLOAT64, out, a.shape());
    }

    public static NdArray map3(NdArray a, NdArray b, NdArray c, Fn3 fn) {
        requireNumeric(a);
        requireCompatible(a, b);
        requireCompatible(a, c);
        double[] out = new double[a.size()];
        for (int i = 0; i < out.length; i++)
            out[i] = fn.apply(a.getDouble(i), b.getDouble(i), c.getDouble(i));
        return NdArray.ofDoubles(DType.FLOAT64, out, a.shape());
    }

    private static void requireNumeric(NdArray a) {
        if (!a.isNumeric())
            throw new IllegalArgumentException("Expected numeric input, got " + a.dtypeTag());
    }

    private static void requireCompatible(NdArray a, NdArray b) {
        requireNumeric(b);
        if (a.size() != b.size())
            throw new IllegalArgumentException("Input sizes differ: " + a.size() + " vs " + b.size());
    }
}

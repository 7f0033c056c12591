package com.streamengine.dpa.fn.generic;

import com.streamengine.dpa.api.DataProductFunction;
import com.streamengine.dpa.api.FunctionArguments;
import com.streamengine.dpa.array.NdArray;
import com.streamengine.dpa.fn.Elementwise;

/**
 * Instrument-agnostic functions. They address their coefficients by declared
 * position, so any catalog entry can reuse them under its own coefficient
 * names.
 */
public final class GenericFunctions {
    private GenericFunctions() {
        // Utility class
    }

    /**
     * Polynomial in {@code p0}; the first declared coefficient holds the terms,
     * highest degree first.
     */
    public static final DataProductFunction POLYVAL = GenericFunctions::polyval;

    /** {@code p0 * slope + offset}; first coefficient slope, second offset. */
    public static final DataProductFunction LINEAR_SCALE = GenericFunctions::linearScale;

    /** {@code p0 - p1}. */
    public static final DataProductFunction DIFFERENCE = Elementwise.binary((a, b) -> a - b);

    /** {@code (p0 + p1) / 2}. */
    public static final DataProductFunction MEAN = Elementwise.binary((a, b) -> (a + b) / 2.0);

    public static double polyval(double[] terms, double x) {
        double y = 0.0;
        for (double c : terms)
            y = y * x + c;
        return y;
    }

    static NdArray polyval(FunctionArguments args) {
        double[] terms = args.coefficientAt(0);
        if (terms.length == 0)
            throw new IllegalArgumentException("polyval needs at least one term");
        return Elementwise.map1(args.array(0), x -> polyval(terms, x));
    }

    static NdArray linearScale(FunctionArguments args) {
        double slope = args.coefficientAt(0)[0];
        double offset = args.coefficientAt(1)[0];
        return Elementwise.map1(args.array(0), x -> x * slope + offset);
    }
}

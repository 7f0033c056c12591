package com.streamengine.dpa.api;

import com.streamengine.dpa.array.NdArray;

/**
 * A transformation function producing one derived parameter (a DPA).
 *
 * Implementations are pure: they read positional arrays {@code p0..pN} and
 * coefficient values from the arguments and return a new array with the same
 * leading-axis length as their positional inputs. They must not keep
 * references to the input arrays.
 */
@FunctionalInterface
public interface DataProductFunction {

    /**
     * @param args bound arguments
     * @return the computed array, never null
     * @throws RuntimeException on any failure; the executor records it as a
     *                          {@link TransformationException}
     */
    NdArray apply(FunctionArguments args);
}

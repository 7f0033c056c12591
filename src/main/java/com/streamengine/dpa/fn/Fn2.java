package com.streamengine.dpa.fn;

/** Scalar kernel with two inputs, lifted over arrays by {@link Elementwise}. */
@FunctionalInterface
public interface Fn2 {
    double apply(double a, double b);
}

package com.streamengine.dpa.fn;

/**
 * Scalar kernel with three inputs, lifted over arrays by {@link Elementwise}.
 *
 * Typical use is a seawater equation of state: {@code (s, t, p) -> rho}.
 */
@FunctionalInterface
public interface Fn3 {
    double apply(double a, double b, double c);
}

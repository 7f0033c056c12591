package com.streamengine.dpa.fn;

/**
 * Scalar kernel with one input, lifted over arrays by {@link Elementwise}.
 *
 * Examples:
 * <ul>
 * <li>{@code x -> x / 100.0 - 10.0}</li>
 * <li>{@code Math::sqrt}</li>
 * </ul>
 */
@FunctionalInterface
public interface Fn1 {
    double apply(double x);
}

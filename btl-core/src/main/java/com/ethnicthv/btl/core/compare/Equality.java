package com.ethnicthv.btl.core.compare;

/**
 * An equality strategy for values of one semantic type.
 * <p>
 * Implementations must be pure and must not throw.
 *
 * @param <T> compared type
 */
@FunctionalInterface
public interface Equality<T> {

    boolean areEqual(T a, T b);

    /** Exact equality, delegating to {@link Object#equals(Object)} (null-safe). */
    static <T> Equality<T> exact() {
        return Comparisons::areEqual;
    }

    /** {@link ComparisonPolicy#FLOAT_TOLERANCE} on boxed floats. */
    static Equality<Float> floatTolerance() {
        return Comparisons::areEqual;
    }

    /** {@link ComparisonPolicy#DOUBLE_TOLERANCE} on boxed doubles. */
    static Equality<Double> doubleTolerance() {
        return Comparisons::areEqual;
    }
}

package com.ethnicthv.btl.core.compare;

/**
 * The closed set of equality policies used by assertions.
 * <p>
 * The policy for a value is fixed by the static type it is compared as, never by
 * inspecting the value at runtime. See {@link Comparisons} for the overloads that
 * select a policy.
 */
public enum ComparisonPolicy {
    /**
     * Delegates to the type's own equality ({@code ==} for primitives,
     * {@link Object#equals(Object)} for references).
     */
    EXACT(0.0),

    /**
     * Single-precision tolerance: equal when {@code |a - b| <= 1e-5}.
     */
    FLOAT_TOLERANCE(1e-5f),

    /**
     * Double-precision tolerance: equal when {@code |a - b| <= 1e-7}.
     */
    DOUBLE_TOLERANCE(1e-7);

    public static final float FLOAT_EPSILON = 1e-5f;
    public static final double DOUBLE_EPSILON = 1e-7;

    private final double epsilon;

    ComparisonPolicy(double epsilon) {
        this.epsilon = epsilon;
    }

    /** Maximum absolute difference still considered equal; zero for {@link #EXACT}. */
    public double epsilon() {
        return epsilon;
    }
}

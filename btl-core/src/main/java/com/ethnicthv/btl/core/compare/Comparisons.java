package com.ethnicthv.btl.core.compare;

import java.util.Objects;

/**
 * Equality checks used by every assertion.
 * <p>
 * Overloads are resolved by the compiler: {@code float} and {@code double} (boxed or not)
 * get tolerance equality, everything else exact equality. Adding a tolerance overload
 * therefore never changes how other types compare. Only {@link #areElementsEqual} looks at
 * runtime types, for ranges whose element type is erased.
 */
public final class Comparisons {

    private Comparisons() {}

    public static boolean areEqual(boolean a, boolean b) {
        return a == b;
    }

    public static boolean areEqual(char a, char b) {
        return a == b;
    }

    public static boolean areEqual(int a, int b) {
        return a == b;
    }

    public static boolean areEqual(long a, long b) {
        return a == b;
    }

    public static boolean areEqual(float a, float b) {
        return Math.abs(a - b) <= ComparisonPolicy.FLOAT_EPSILON;
    }

    public static boolean areEqual(double a, double b) {
        return Math.abs(a - b) <= ComparisonPolicy.DOUBLE_EPSILON;
    }

    public static boolean areEqual(Float a, Float b) {
        if (a == null || b == null) return a == b;
        return areEqual(a.floatValue(), b.floatValue());
    }

    public static boolean areEqual(Double a, Double b) {
        if (a == null || b == null) return a == b;
        return areEqual(a.doubleValue(), b.doubleValue());
    }

    public static <T> boolean areEqual(T a, T b) {
        return Objects.equals(a, b);
    }

    /**
     * Equality of two elements of a range whose element type is erased ({@code T[]},
     * {@code List<T>}): a pair of boxed floats or of boxed doubles uses its tolerance,
     * anything else {@link Objects#equals}.
     */
    public static boolean areElementsEqual(Object a, Object b) {
        if (a instanceof Float x && b instanceof Float y) return areEqual(x, y);
        if (a instanceof Double x && b instanceof Double y) return areEqual(x, y);
        return Objects.equals(a, b);
    }
}

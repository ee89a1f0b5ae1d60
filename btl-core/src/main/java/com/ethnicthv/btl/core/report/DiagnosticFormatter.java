package com.ethnicthv.btl.core.report;

import com.ethnicthv.btl.core.compare.IndexedComparison;

import java.util.Arrays;

/**
 * Builds the detail text printed after a failed assertion.
 * <p>
 * Every method is a pure function of its arguments and never throws, whatever it is given.
 */
public final class DiagnosticFormatter {

    static final String MISSING = "<missing>";

    private DiagnosticFormatter() {}

    /**
     * Canonical text of a value: {@code true}/{@code false} for booleans, {@code null} for null,
     * element lists for arrays, {@link String#valueOf(Object)} for the rest.
     */
    public static String render(Object value) {
        if (value == null) return "null";
        if (value instanceof Boolean b) return b ? "true" : "false";
        if (value.getClass().isArray()) return renderArray(value);
        try {
            return String.valueOf(value);
        } catch (RuntimeException ex) {
            // toString() of the value under test may itself be broken
            return value.getClass().getName() + "@" + Integer.toHexString(System.identityHashCode(value))
                    + " (toString threw " + ex.getClass().getSimpleName() + ")";
        }
    }

    /** {@code "<expected> expected; got <actual>"}. */
    public static String formatScalarFailure(Object expected, Object actual) {
        return render(expected) + " expected; got " + render(actual);
    }

    /** Identity variant of {@link #formatScalarFailure}: both sides rendered as {@code Type@hash}. */
    public static String formatIdentityFailure(Object expected, Object actual) {
        return identity(expected) + " expected; got " + identity(actual);
    }

    /**
     * One line per index in {@code [start, endExclusive)} whose elements differ:
     * {@code "\t\t- <expected> expected at index #<i>; got <actual>"}, each preceded by a
     * line break. Returns the empty string when nothing differs, which includes every
     * range with {@code endExclusive <= start}.
     */
    public static String formatRangeFailure(IndexedComparison range, int start, int endExclusive) {
        StringBuilder sb = new StringBuilder();
        for (int i = start; i < endExclusive; i++) {
            if (range.matches(i)) continue;
            sb.append(System.lineSeparator())
              .append("\t\t- ").append(range.hasExpected(i) ? render(range.expected(i)) : MISSING)
              .append(" expected at index #").append(i)
              .append("; got ").append(range.hasActual(i) ? render(range.actual(i)) : MISSING);
        }
        return sb.toString();
    }

    private static String identity(Object value) {
        if (value == null) return "null";
        return value.getClass().getName() + "@" + Integer.toHexString(System.identityHashCode(value));
    }

    private static String renderArray(Object array) {
        if (array instanceof Object[] a) return Arrays.deepToString(a);
        if (array instanceof int[] a) return Arrays.toString(a);
        if (array instanceof long[] a) return Arrays.toString(a);
        if (array instanceof float[] a) return Arrays.toString(a);
        if (array instanceof double[] a) return Arrays.toString(a);
        if (array instanceof boolean[] a) return Arrays.toString(a);
        if (array instanceof char[] a) return Arrays.toString(a);
        if (array instanceof byte[] a) return Arrays.toString(a);
        if (array instanceof short[] a) return Arrays.toString(a);
        return identity(array);
    }
}

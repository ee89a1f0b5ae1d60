package com.ethnicthv.btl.core.compare;

import java.util.List;

/**
 * Element-wise view over an expected and an actual indexed sequence.
 * <p>
 * The factory overload taken decides the {@link ComparisonPolicy}: {@code float[]},
 * {@code double[]}, {@code Float[]} and {@code Double[]} compare with tolerance, everything
 * else exactly. An index outside
 * either sequence never matches; nothing here throws.
 */
public interface IndexedComparison {

    /** Policy used by {@link #matches(int)}. */
    ComparisonPolicy policy();

    int expectedLength();

    int actualLength();

    /** Whether both sequences have an element at {@code index} and those elements are equal. */
    boolean matches(int index);

    /** Expected element at {@code index}, boxed. Only valid when {@code index < expectedLength()}. */
    Object expected(int index);

    /** Actual element at {@code index}, boxed. Only valid when {@code index < actualLength()}. */
    Object actual(int index);

    default boolean hasExpected(int index) {
        return index >= 0 && index < expectedLength();
    }

    default boolean hasActual(int index) {
        return index >= 0 && index < actualLength();
    }

    // =================================================================
    // Factories (expected first, actual second)
    // =================================================================

    static IndexedComparison of(int[] expected, int[] actual) {
        return new Backed(ComparisonPolicy.EXACT,
                expected == null ? 0 : expected.length, actual == null ? 0 : actual.length,
                i -> expected[i] == actual[i], i -> expected[i], i -> actual[i]);
    }

    static IndexedComparison of(long[] expected, long[] actual) {
        return new Backed(ComparisonPolicy.EXACT,
                expected == null ? 0 : expected.length, actual == null ? 0 : actual.length,
                i -> expected[i] == actual[i], i -> expected[i], i -> actual[i]);
    }

    static IndexedComparison of(float[] expected, float[] actual) {
        return new Backed(ComparisonPolicy.FLOAT_TOLERANCE,
                expected == null ? 0 : expected.length, actual == null ? 0 : actual.length,
                i -> Comparisons.areEqual(expected[i], actual[i]), i -> expected[i], i -> actual[i]);
    }

    static IndexedComparison of(double[] expected, double[] actual) {
        return new Backed(ComparisonPolicy.DOUBLE_TOLERANCE,
                expected == null ? 0 : expected.length, actual == null ? 0 : actual.length,
                i -> Comparisons.areEqual(expected[i], actual[i]), i -> expected[i], i -> actual[i]);
    }

    static IndexedComparison of(boolean[] expected, boolean[] actual) {
        return new Backed(ComparisonPolicy.EXACT,
                expected == null ? 0 : expected.length, actual == null ? 0 : actual.length,
                i -> expected[i] == actual[i], i -> expected[i], i -> actual[i]);
    }

    static IndexedComparison of(char[] expected, char[] actual) {
        return new Backed(ComparisonPolicy.EXACT,
                expected == null ? 0 : expected.length, actual == null ? 0 : actual.length,
                i -> expected[i] == actual[i], i -> expected[i], i -> actual[i]);
    }

    static IndexedComparison of(Float[] expected, Float[] actual) {
        return new Backed(ComparisonPolicy.FLOAT_TOLERANCE,
                expected == null ? 0 : expected.length, actual == null ? 0 : actual.length,
                i -> Comparisons.areEqual(expected[i], actual[i]), i -> expected[i], i -> actual[i]);
    }

    static IndexedComparison of(Double[] expected, Double[] actual) {
        return new Backed(ComparisonPolicy.DOUBLE_TOLERANCE,
                expected == null ? 0 : expected.length, actual == null ? 0 : actual.length,
                i -> Comparisons.areEqual(expected[i], actual[i]), i -> expected[i], i -> actual[i]);
    }

    /**
     * Element type erased: reports {@link ComparisonPolicy#EXACT}, but boxed {@code Float} and
     * {@code Double} elements are still compared with their tolerance.
     */
    static <T> IndexedComparison of(T[] expected, T[] actual) {
        return new Backed(ComparisonPolicy.EXACT,
                expected == null ? 0 : expected.length, actual == null ? 0 : actual.length,
                i -> Comparisons.areElementsEqual(expected[i], actual[i]), i -> expected[i], i -> actual[i]);
    }

    /** Same element rules as {@link #of(Object[], Object[])}. */
    static <T> IndexedComparison of(List<? extends T> expected, List<? extends T> actual) {
        return new Backed(ComparisonPolicy.EXACT,
                expected == null ? 0 : expected.size(), actual == null ? 0 : actual.size(),
                i -> Comparisons.areElementsEqual(expected.get(i), actual.get(i)),
                i -> expected.get(i), i -> actual.get(i));
    }

    /**
     * Bounds-checking implementation shared by all factories. Element accessors are only
     * invoked for indices that exist on the side they read.
     */
    final class Backed implements IndexedComparison {
        @FunctionalInterface
        interface IndexPredicate {
            boolean test(int index);
        }

        @FunctionalInterface
        interface IndexAccessor {
            Object get(int index);
        }

        private final ComparisonPolicy policy;
        private final int expectedLength;
        private final int actualLength;
        private final IndexPredicate equal;
        private final IndexAccessor expected;
        private final IndexAccessor actual;

        Backed(ComparisonPolicy policy,
               int expectedLength,
               int actualLength,
               IndexPredicate equal,
               IndexAccessor expected,
               IndexAccessor actual) {
            this.policy = policy;
            this.expectedLength = expectedLength;
            this.actualLength = actualLength;
            this.equal = equal;
            this.expected = expected;
            this.actual = actual;
        }

        @Override
        public ComparisonPolicy policy() {
            return policy;
        }

        @Override
        public int expectedLength() {
            return expectedLength;
        }

        @Override
        public int actualLength() {
            return actualLength;
        }

        @Override
        public boolean matches(int index) {
            if (!hasExpected(index) || !hasActual(index)) return false;
            return equal.test(index);
        }

        @Override
        public Object expected(int index) {
            return expected.get(index);
        }

        @Override
        public Object actual(int index) {
            return actual.get(index);
        }
    }
}

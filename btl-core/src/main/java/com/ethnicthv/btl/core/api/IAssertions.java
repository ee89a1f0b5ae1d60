package com.ethnicthv.btl.core.api;

import java.util.List;

/**
 * Assertions available inside a test case body.
 * <p>
 * Every assertion is recorded and reported, pass or fail, and never throws on failure:
 * the test case keeps running after a failed assertion. Arguments are {@code (actual, expected)}.
 * Each method returns whether the assertion passed.
 * <p>
 * {@code float} and {@code double} overloads (and their boxed forms) compare with a fixed
 * tolerance of {@code 1e-5} and {@code 1e-7}; all others compare exactly.
 */
public interface IAssertions {

    boolean assertAreEqual(boolean actual, boolean expected);

    boolean assertAreEqual(char actual, char expected);

    boolean assertAreEqual(int actual, int expected);

    boolean assertAreEqual(long actual, long expected);

    boolean assertAreEqual(float actual, float expected);

    boolean assertAreEqual(double actual, double expected);

    boolean assertAreEqual(Float actual, Float expected);

    boolean assertAreEqual(Double actual, Double expected);

    <V> boolean assertAreEqual(V actual, V expected);

    /** Passes when both references point to the same instance. */
    boolean assertAreSame(Object actual, Object expected);

    boolean assertIsTrue(boolean value);

    boolean assertIsFalse(boolean value);

    /**
     * Element-wise comparison over {@code [start, endExclusive)}. One diagnostic line per
     * differing index; an empty range passes.
     */
    boolean assertArraysAreEqual(int[] actual, int[] expected, int start, int endExclusive);

    boolean assertArraysAreEqual(long[] actual, long[] expected, int start, int endExclusive);

    boolean assertArraysAreEqual(float[] actual, float[] expected, int start, int endExclusive);

    boolean assertArraysAreEqual(double[] actual, double[] expected, int start, int endExclusive);

    boolean assertArraysAreEqual(boolean[] actual, boolean[] expected, int start, int endExclusive);

    boolean assertArraysAreEqual(char[] actual, char[] expected, int start, int endExclusive);

    boolean assertArraysAreEqual(Float[] actual, Float[] expected, int start, int endExclusive);

    boolean assertArraysAreEqual(Double[] actual, Double[] expected, int start, int endExclusive);

    <V> boolean assertArraysAreEqual(V[] actual, V[] expected, int start, int endExclusive);

    /** Boxed {@code Float} and {@code Double} elements are compared with their tolerance. */
    <V> boolean assertListsAreEqual(List<? extends V> actual, List<? extends V> expected, int start, int endExclusive);
}

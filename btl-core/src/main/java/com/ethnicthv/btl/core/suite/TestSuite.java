package com.ethnicthv.btl.core.suite;

import com.ethnicthv.btl.core.api.Description;
import com.ethnicthv.btl.core.api.IAssertions;
import com.ethnicthv.btl.core.api.ISuite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for the test suite of one subject type.
 * <p>
 * Test cases are declared from the subclass constructor, in the order they should run:
 * <pre>{@code
 * public final class Vector3fSuite extends TestSuite<Vector3f> {
 *     public Vector3fSuite() {
 *         super(Vector3f.class);
 *
 *         describeTest("add", "both vectors are non-zero", "sum each component", () -> {
 *             Vector3f sum = new Vector3f(1, 2, 3).add(new Vector3f(4, 5, 6));
 *             assertAreEqual(sum.x(), 5f);
 *             assertAreEqual(sum.y(), 7f);
 *             assertAreEqual(sum.z(), 9f);
 *         });
 *     }
 * }
 * }</pre>
 * Annotating the subclass with {@link com.ethnicthv.btl.core.suite.annotation.DescribeClass}
 * registers it for discovery. The list is frozen once a registry builds the suite or it first runs. Assertion methods are
 * only usable from inside a running test case body.
 *
 * @param <T> subject type
 */
public abstract class TestSuite<T> implements ISuite<T>, IAssertions {

    private final Class<T> subject;
    private final String name;
    private final List<TestCase> tests = new ArrayList<>();
    private final List<TestCase> view = Collections.unmodifiableList(tests);
    private boolean frozen;
    private Assertions assertions;

    /** Suite displayed under the subject's simple class name. */
    protected TestSuite(Class<T> subject) {
        this(subject, subject == null ? null : subject.getSimpleName());
    }

    /** Suite displayed under an explicit name. */
    protected TestSuite(Class<T> subject, String name) {
        if (subject == null) {
            throw new IllegalArgumentException("Subject type cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Display name cannot be null or blank for " + subject.getName());
        }
        this.subject = subject;
        this.name = name;
    }

    /**
     * Append a test case.
     *
     * @param method      operation under test, rendered as {@code method()}
     * @param situation   circumstances the operation is exercised in
     * @param expectation outcome the operation should produce
     * @param body        assertions to run
     * @throws IllegalStateException if the suite has already been registered or run
     */
    protected final void describeTest(String method, String situation, String expectation, Runnable body) {
        if (frozen) {
            throw new IllegalStateException("Test list of '" + name + "' is frozen; declare tests in the constructor");
        }
        tests.add(new TestCase(new Description(method, situation, expectation), body));
    }

    @Override
    public final Class<T> subject() {
        return subject;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final List<TestCase> tests() {
        return view;
    }

    final void freeze() {
        frozen = true;
    }

    final boolean isFrozen() {
        return frozen;
    }

    final void bind(Assertions assertions) {
        this.assertions = assertions;
    }

    private IAssertions assertions() {
        Assertions bound = assertions;
        if (bound == null) {
            throw new IllegalStateException("Suite '" + name + "' is not running; assertions are only available inside a test case");
        }
        return bound;
    }

    // =================================================================
    // IAssertions delegates
    // =================================================================

    @Override
    public final boolean assertAreEqual(boolean actual, boolean expected) {
        return assertions().assertAreEqual(actual, expected);
    }

    @Override
    public final boolean assertAreEqual(char actual, char expected) {
        return assertions().assertAreEqual(actual, expected);
    }

    @Override
    public final boolean assertAreEqual(int actual, int expected) {
        return assertions().assertAreEqual(actual, expected);
    }

    @Override
    public final boolean assertAreEqual(long actual, long expected) {
        return assertions().assertAreEqual(actual, expected);
    }

    @Override
    public final boolean assertAreEqual(float actual, float expected) {
        return assertions().assertAreEqual(actual, expected);
    }

    @Override
    public final boolean assertAreEqual(double actual, double expected) {
        return assertions().assertAreEqual(actual, expected);
    }

    @Override
    public final boolean assertAreEqual(Float actual, Float expected) {
        return assertions().assertAreEqual(actual, expected);
    }

    @Override
    public final boolean assertAreEqual(Double actual, Double expected) {
        return assertions().assertAreEqual(actual, expected);
    }

    @Override
    public final <V> boolean assertAreEqual(V actual, V expected) {
        return assertions().assertAreEqual(actual, expected);
    }

    @Override
    public final boolean assertAreSame(Object actual, Object expected) {
        return assertions().assertAreSame(actual, expected);
    }

    @Override
    public final boolean assertIsTrue(boolean value) {
        return assertions().assertIsTrue(value);
    }

    @Override
    public final boolean assertIsFalse(boolean value) {
        return assertions().assertIsFalse(value);
    }

    @Override
    public final boolean assertArraysAreEqual(int[] actual, int[] expected, int start, int endExclusive) {
        return assertions().assertArraysAreEqual(actual, expected, start, endExclusive);
    }

    @Override
    public final boolean assertArraysAreEqual(long[] actual, long[] expected, int start, int endExclusive) {
        return assertions().assertArraysAreEqual(actual, expected, start, endExclusive);
    }

    @Override
    public final boolean assertArraysAreEqual(float[] actual, float[] expected, int start, int endExclusive) {
        return assertions().assertArraysAreEqual(actual, expected, start, endExclusive);
    }

    @Override
    public final boolean assertArraysAreEqual(double[] actual, double[] expected, int start, int endExclusive) {
        return assertions().assertArraysAreEqual(actual, expected, start, endExclusive);
    }

    @Override
    public final boolean assertArraysAreEqual(boolean[] actual, boolean[] expected, int start, int endExclusive) {
        return assertions().assertArraysAreEqual(actual, expected, start, endExclusive);
    }

    @Override
    public final boolean assertArraysAreEqual(char[] actual, char[] expected, int start, int endExclusive) {
        return assertions().assertArraysAreEqual(actual, expected, start, endExclusive);
    }

    @Override
    public final boolean assertArraysAreEqual(Float[] actual, Float[] expected, int start, int endExclusive) {
        return assertions().assertArraysAreEqual(actual, expected, start, endExclusive);
    }

    @Override
    public final boolean assertArraysAreEqual(Double[] actual, Double[] expected, int start, int endExclusive) {
        return assertions().assertArraysAreEqual(actual, expected, start, endExclusive);
    }

    @Override
    public final <V> boolean assertArraysAreEqual(V[] actual, V[] expected, int start, int endExclusive) {
        return assertions().assertArraysAreEqual(actual, expected, start, endExclusive);
    }

    @Override
    public final <V> boolean assertListsAreEqual(List<? extends V> actual, List<? extends V> expected,
                                                 int start, int endExclusive) {
        return assertions().<V>assertListsAreEqual(actual, expected, start, endExclusive);
    }

    @Override
    public String toString() {
        return "TestSuite[" + name + ", " + tests.size() + " tests]";
    }
}

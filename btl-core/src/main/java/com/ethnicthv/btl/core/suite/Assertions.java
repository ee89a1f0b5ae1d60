package com.ethnicthv.btl.core.suite;

import com.ethnicthv.btl.core.api.Description;
import com.ethnicthv.btl.core.api.IAssertions;
import com.ethnicthv.btl.core.compare.Comparisons;
import com.ethnicthv.btl.core.compare.IndexedComparison;
import com.ethnicthv.btl.core.report.DiagnosticFormatter;
import com.ethnicthv.btl.core.report.Reporter;
import com.ethnicthv.btl.core.report.SourceLocation;

import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link IAssertions} bound to one suite run.
 * <p>
 * {@link SuiteRunner} points it at the running test case before each body is invoked;
 * assertions made while no test case is running are rejected.
 */
public final class Assertions implements IAssertions {

    // Frames skipped when looking for the assertion's call site
    private static final Set<Class<?>> LIBRARY_FRAMES = Set.of(Assertions.class, TestSuite.class);

    private final Reporter reporter;
    private final String subject;
    private Description current;

    public Assertions(Reporter reporter, String subject) {
        if (reporter == null) throw new IllegalArgumentException("reporter must not be null");
        if (subject == null) throw new IllegalArgumentException("subject must not be null");
        this.reporter = reporter;
        this.subject = subject;
    }

    void enter(Description description) {
        this.current = description;
    }

    void exit() {
        this.current = null;
    }

    // =================================================================
    // Scalar equality
    // =================================================================

    @Override
    public boolean assertAreEqual(boolean actual, boolean expected) {
        return report(Comparisons.areEqual(actual, expected),
                () -> DiagnosticFormatter.formatScalarFailure(expected, actual));
    }

    @Override
    public boolean assertAreEqual(char actual, char expected) {
        return report(Comparisons.areEqual(actual, expected),
                () -> DiagnosticFormatter.formatScalarFailure(expected, actual));
    }

    @Override
    public boolean assertAreEqual(int actual, int expected) {
        return report(Comparisons.areEqual(actual, expected),
                () -> DiagnosticFormatter.formatScalarFailure(expected, actual));
    }

    @Override
    public boolean assertAreEqual(long actual, long expected) {
        return report(Comparisons.areEqual(actual, expected),
                () -> DiagnosticFormatter.formatScalarFailure(expected, actual));
    }

    @Override
    public boolean assertAreEqual(float actual, float expected) {
        return report(Comparisons.areEqual(actual, expected),
                () -> DiagnosticFormatter.formatScalarFailure(expected, actual));
    }

    @Override
    public boolean assertAreEqual(double actual, double expected) {
        return report(Comparisons.areEqual(actual, expected),
                () -> DiagnosticFormatter.formatScalarFailure(expected, actual));
    }

    @Override
    public boolean assertAreEqual(Float actual, Float expected) {
        return report(Comparisons.areEqual(actual, expected),
                () -> DiagnosticFormatter.formatScalarFailure(expected, actual));
    }

    @Override
    public boolean assertAreEqual(Double actual, Double expected) {
        return report(Comparisons.areEqual(actual, expected),
                () -> DiagnosticFormatter.formatScalarFailure(expected, actual));
    }

    @Override
    public <V> boolean assertAreEqual(V actual, V expected) {
        return report(Comparisons.areEqual(actual, expected),
                () -> DiagnosticFormatter.formatScalarFailure(expected, actual));
    }

    @Override
    public boolean assertAreSame(Object actual, Object expected) {
        return report(actual == expected,
                () -> DiagnosticFormatter.formatIdentityFailure(expected, actual));
    }

    @Override
    public boolean assertIsTrue(boolean value) {
        return assertAreEqual(value, true);
    }

    @Override
    public boolean assertIsFalse(boolean value) {
        return assertAreEqual(value, false);
    }

    // =================================================================
    // Range equality
    // =================================================================

    @Override
    public boolean assertArraysAreEqual(int[] actual, int[] expected, int start, int endExclusive) {
        return reportRange(IndexedComparison.of(expected, actual), start, endExclusive);
    }

    @Override
    public boolean assertArraysAreEqual(long[] actual, long[] expected, int start, int endExclusive) {
        return reportRange(IndexedComparison.of(expected, actual), start, endExclusive);
    }

    @Override
    public boolean assertArraysAreEqual(float[] actual, float[] expected, int start, int endExclusive) {
        return reportRange(IndexedComparison.of(expected, actual), start, endExclusive);
    }

    @Override
    public boolean assertArraysAreEqual(double[] actual, double[] expected, int start, int endExclusive) {
        return reportRange(IndexedComparison.of(expected, actual), start, endExclusive);
    }

    @Override
    public boolean assertArraysAreEqual(boolean[] actual, boolean[] expected, int start, int endExclusive) {
        return reportRange(IndexedComparison.of(expected, actual), start, endExclusive);
    }

    @Override
    public boolean assertArraysAreEqual(char[] actual, char[] expected, int start, int endExclusive) {
        return reportRange(IndexedComparison.of(expected, actual), start, endExclusive);
    }

    @Override
    public boolean assertArraysAreEqual(Float[] actual, Float[] expected, int start, int endExclusive) {
        return reportRange(IndexedComparison.of(expected, actual), start, endExclusive);
    }

    @Override
    public boolean assertArraysAreEqual(Double[] actual, Double[] expected, int start, int endExclusive) {
        return reportRange(IndexedComparison.of(expected, actual), start, endExclusive);
    }

    @Override
    public <V> boolean assertArraysAreEqual(V[] actual, V[] expected, int start, int endExclusive) {
        return reportRange(IndexedComparison.of(expected, actual), start, endExclusive);
    }

    @Override
    public <V> boolean assertListsAreEqual(List<? extends V> actual, List<? extends V> expected,
                                           int start, int endExclusive) {
        return reportRange(IndexedComparison.<V>of(expected, actual), start, endExclusive);
    }

    // =================================================================
    // Reporting
    // =================================================================

    private boolean reportRange(IndexedComparison range, int start, int endExclusive) {
        String detail = DiagnosticFormatter.formatRangeFailure(range, start, endExclusive);
        return report(detail.isEmpty(), () -> detail);
    }

    private boolean report(boolean passed, Supplier<String> detail) {
        Description running = current;
        if (running == null) {
            throw new IllegalStateException("Assertions are only available while a test case of '"
                    + subject + "' is running");
        }
        // The call site is only printed for failures
        SourceLocation location = passed ? SourceLocation.UNKNOWN : SourceLocation.capture(LIBRARY_FRAMES);
        return reporter.reportAssertion(passed, subject, running, location, detail);
    }
}

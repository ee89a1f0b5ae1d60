package com.ethnicthv.btl.core.suite;

import com.ethnicthv.btl.core.report.Reporter;

/**
 * Runs the test cases of a suite one after another, in declaration order, on the
 * calling thread.
 * <p>
 * Test cases are not isolated from each other: state a case leaves behind is seen by
 * the cases after it. A failed assertion never stops a run; the outcome is visible only
 * through the reporter's failure counter. After the last case a blank separator line is
 * printed.
 */
public final class SuiteRunner {

    private final Reporter reporter;
    private final UncaughtExceptionPolicy exceptionPolicy;

    public SuiteRunner(Reporter reporter, UncaughtExceptionPolicy exceptionPolicy) {
        if (reporter == null) throw new IllegalArgumentException("reporter must not be null");
        if (exceptionPolicy == null) throw new IllegalArgumentException("exceptionPolicy must not be null");
        this.reporter = reporter;
        this.exceptionPolicy = exceptionPolicy;
    }

    public SuiteRunner(Reporter reporter) {
        this(reporter, UncaughtExceptionPolicy.RECORD);
    }

    public void run(TestSuite<?> suite) {
        if (suite == null) {
            throw new IllegalArgumentException("Suite cannot be null");
        }
        suite.freeze();
        Assertions assertions = new Assertions(reporter, suite.name());
        suite.bind(assertions);
        try {
            for (TestCase test : suite.tests()) {
                assertions.enter(test.description());
                try {
                    test.procedure().run();
                } catch (Exception ex) {
                    if (exceptionPolicy == UncaughtExceptionPolicy.PROPAGATE) {
                        throw ex;
                    }
                    reporter.reportUnexpectedException(suite.name(), test.description(), ex);
                } finally {
                    assertions.exit();
                }
            }
        } finally {
            suite.bind(null);
        }
        reporter.reportSuiteEnd();
    }

    public Reporter getReporter() {
        return reporter;
    }

    public UncaughtExceptionPolicy getExceptionPolicy() {
        return exceptionPolicy;
    }
}

package com.ethnicthv.btl.core.suite;

/**
 * What {@link SuiteRunner} does when a test case body throws.
 * <p>
 * {@link Error}s are never intercepted under either policy.
 */
public enum UncaughtExceptionPolicy {
    /**
     * Report the exception as a failure of the running test case (one increment of the
     * failure counter, diagnostic pointing at the throw site) and continue with the next
     * test case.
     */
    RECORD,

    /**
     * Let the exception escape {@link SuiteRunner#run(TestSuite)}. Remaining test cases of
     * the suite are skipped and no separator line is printed.
     */
    PROPAGATE
}

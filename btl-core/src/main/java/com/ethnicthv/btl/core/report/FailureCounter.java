package com.ethnicthv.btl.core.report;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Count of failed assertions.
 * <p>
 * Starts at zero and only ever grows: there is no reset. The only writer is
 * {@link Reporter}, which adds exactly one per failed assertion. Runs share the
 * process-wide {@link #global()} instance unless a caller passes its own counter.
 */
public final class FailureCounter {

    private static final FailureCounter GLOBAL = new FailureCounter();

    private final AtomicLong failures = new AtomicLong();

    /** The process-wide counter, created at class initialisation and never replaced. */
    public static FailureCounter global() {
        return GLOBAL;
    }

    void increment() {
        failures.incrementAndGet();
    }

    public long count() {
        return failures.get();
    }

    public boolean hasFailures() {
        return failures.get() > 0;
    }

    @Override
    public String toString() {
        return "FailureCounter[" + failures.get() + "]";
    }
}

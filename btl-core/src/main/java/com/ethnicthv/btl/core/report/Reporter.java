package com.ethnicthv.btl.core.report;

import com.ethnicthv.btl.core.api.Description;

import java.io.PrintStream;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Reporting entry point for assertion outcomes.
 * <p>
 * Passed assertions print one {@code OK!} line to the standard stream. Failed assertions
 * add one to the {@link FailureCounter} and print the location and detail to the error
 * stream. Line layout:
 * <pre>
 *     \t&lt;subject&gt;::&lt;description&gt; OK!
 *     \t&lt;subject&gt;::&lt;description&gt; File.java(42): Assertion failed! ❌ &lt;detail&gt;
 * </pre>
 */
public final class Reporter {

    private final FailureCounter counter;
    private final PrintStream out;
    private final PrintStream err;
    private final ConsoleStyle style;

    public Reporter(FailureCounter counter, PrintStream out, PrintStream err, ConsoleStyle style) {
        this.counter = Objects.requireNonNull(counter, "counter");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.style = Objects.requireNonNull(style, "style");
    }

    /** Reporter on {@code System.out}/{@code System.err} feeding the process-wide counter. */
    public static Reporter console(ConsoleStyle style) {
        return new Reporter(FailureCounter.global(), System.out, System.err, style);
    }

    /**
     * Record one assertion outcome.
     *
     * @param passed          comparison result
     * @param subject         display name of the suite's subject type
     * @param description     the running test case
     * @param location        call site of the assertion
     * @param detailOnFailure detail text, only evaluated when {@code passed} is false
     * @return {@code passed}
     */
    public boolean reportAssertion(boolean passed,
                                   String subject,
                                   Description description,
                                   SourceLocation location,
                                   Supplier<String> detailOnFailure) {
        if (passed) {
            out.println(prefix(subject, description) + style.success() + "OK!" + style.normal());
            return true;
        }
        counter.increment();
        err.println(prefix(subject, description) + locationText(location)
                + style.failure() + " Assertion failed! ❌ " + style.normal() + detailOnFailure.get());
        return false;
    }

    /** Record a test procedure that threw; counts as one failure. */
    public void reportUnexpectedException(String subject, Description description, Throwable error) {
        counter.increment();
        err.println(prefix(subject, description) + locationText(SourceLocation.of(error))
                + style.failure() + " Unexpected exception! ❌ " + style.normal() + DiagnosticFormatter.render(error));
    }

    /** Blank separator after a completed suite. */
    public void reportSuiteEnd() {
        out.println();
        out.flush();
        err.flush();
    }

    public FailureCounter counter() {
        return counter;
    }

    public ConsoleStyle style() {
        return style;
    }

    /** Stream failure lines are written to. */
    public PrintStream errorStream() {
        return err;
    }

    private String prefix(String subject, Description description) {
        return "\t" + style.subject() + subject + style.normal() + "::" + description.render(style) + " ";
    }

    private String locationText(SourceLocation location) {
        return style.location() + location + ":" + style.normal();
    }
}

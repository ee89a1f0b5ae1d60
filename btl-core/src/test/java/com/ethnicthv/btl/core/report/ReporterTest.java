package com.ethnicthv.btl.core.report;

import com.ethnicthv.btl.CapturedOutput;
import com.ethnicthv.btl.core.api.Description;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Reporter")
public class ReporterTest {

    private static final Description ADD = new Description("add", "both operands are positive", "return the sum");

    private CapturedOutput output;
    private Reporter reporter;

    @BeforeEach
    void setUp() {
        output = new CapturedOutput();
        reporter = output.reporter();
    }

    @Test
    @DisplayName("A passed assertion prints one OK line and leaves the counter alone")
    void testPassedAssertion() {
        boolean result = reporter.reportAssertion(true, "Calculator", ADD, SourceLocation.UNKNOWN,
                () -> { throw new AssertionError("detail must not be built for a pass"); });

        assertTrue(result);
        assertEquals(List.of("\tCalculator::add() should return the sum when both operands are positive OK!"),
                output.outLines());
        assertEquals("", output.err());
        assertEquals(0, output.counter.count());
    }

    @Test
    @DisplayName("A failed assertion prints location and detail to err and counts once")
    void testFailedAssertion() {
        boolean result = reporter.reportAssertion(false, "Calculator", ADD,
                new SourceLocation("CalculatorSuite.java", 42),
                () -> DiagnosticFormatter.formatScalarFailure(5, 7));

        assertFalse(result);
        assertEquals(List.of("\tCalculator::add() should return the sum when both operands are positive "
                + "CalculatorSuite.java(42): Assertion failed! ❌ 5 expected; got 7"), output.errLines());
        assertEquals("", output.out());
        assertEquals(1, output.counter.count());
    }

    @Test
    @DisplayName("An unexpected exception counts once and names the exception")
    void testUnexpectedException() {
        IllegalStateException error = new IllegalStateException("boom");
        reporter.reportUnexpectedException("Calculator", ADD, error);

        assertEquals(1, output.counter.count());
        List<String> lines = output.errLines();
        assertEquals(1, lines.size());
        String line = lines.get(0);
        assertTrue(line.startsWith("\tCalculator::add() should return the sum when both operands are positive "
                + "ReporterTest.java("), line);
        assertTrue(line.endsWith(" Unexpected exception! ❌ java.lang.IllegalStateException: boom"), line);
    }

    @Test
    @DisplayName("Suite end prints a single blank line")
    void testSuiteEnd() {
        reporter.reportSuiteEnd();
        assertEquals(System.lineSeparator(), output.out());
        assertEquals(0, output.counter.count());
    }

    @Test
    @DisplayName("ANSI style wraps the line parts in escape sequences")
    void testAnsiStyle() {
        Reporter ansi = output.reporter(ConsoleStyle.ANSI);
        ansi.reportAssertion(true, "Calculator", ADD, SourceLocation.UNKNOWN, () -> "");

        String line = output.outLines().get(0);
        assertTrue(line.startsWith("\t\033[95;1mCalculator\033[0m::\033[0;1madd()\033[0m should"), line);
        assertTrue(line.endsWith("\033[92;1mOK!\033[0m"), line);
    }

    @Test
    @DisplayName("Null collaborators are rejected")
    void testNullArguments() {
        assertThrows(NullPointerException.class,
                () -> new Reporter(null, output.out, output.err, ConsoleStyle.PLAIN));
        assertThrows(NullPointerException.class,
                () -> new Reporter(output.counter, output.out, output.err, null));
    }
}

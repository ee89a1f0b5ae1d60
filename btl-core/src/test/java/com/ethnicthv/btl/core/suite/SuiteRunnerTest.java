package com.ethnicthv.btl.core.suite;

import com.ethnicthv.btl.CapturedOutput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Suite runner")
public class SuiteRunnerTest {

    private CapturedOutput output;
    private SuiteRunner runner;

    @BeforeEach
    void setUp() {
        output = new CapturedOutput();
        runner = new SuiteRunner(output.reporter());
    }

    @Test
    @DisplayName("An empty suite adds no failures and prints one blank line")
    void testEmptySuite() {
        runner.run(new ScriptedSuite<>(String.class));

        assertEquals(0, output.counter.count());
        assertEquals(System.lineSeparator(), output.out());
        assertEquals("", output.err());
    }

    @Test
    @DisplayName("A failed assertion adds one failure and the remaining cases still run")
    void testFailureDoesNotStopRun() {
        List<String> executed = new ArrayList<>();
        ScriptedSuite<String> suite = new ScriptedSuite<>(String.class);
        suite.test("length", "the string is empty", "return 0", () -> {
                    executed.add("length");
                    suite.assertAreEqual("".length(), 0);
                })
                .test("trim", "there is surrounding space", "remove it", () -> {
                    executed.add("trim");
                    suite.assertAreEqual(" a ".trim(), "a ");
                })
                .test("isBlank", "only spaces are present", "return true", () -> {
                    executed.add("isBlank");
                    suite.assertIsTrue("   ".isBlank());
                });

        runner.run(suite);

        assertEquals(List.of("length", "trim", "isBlank"), executed);
        assertEquals(1, output.counter.count());
        assertEquals(List.of(
                "\tString::length() should return 0 when the string is empty OK!",
                "\tString::isBlank() should return true when only spaces are present OK!",
                ""), output.outLines());

        List<String> errors = output.errLines();
        assertEquals(1, errors.size());
        String failure = errors.get(0);
        assertTrue(failure.startsWith("\tString::trim() should remove it when there is surrounding space "
                + "SuiteRunnerTest.java("), failure);
        assertTrue(failure.endsWith("): Assertion failed! ❌ a  expected; got a"), failure);
    }

    @Test
    @DisplayName("Every failed assertion in a case is counted")
    void testSeveralFailuresInOneCase() {
        ScriptedSuite<String> suite = new ScriptedSuite<>(String.class);
        suite.test("length", () -> {
            suite.assertAreEqual("abc".length(), 2);
            suite.assertAreEqual("abc".length(), 3);
            suite.assertIsFalse("abc".isEmpty());
            suite.assertIsTrue("abc".isEmpty());
        });

        runner.run(suite);

        assertEquals(2, output.counter.count());
        assertEquals(2, output.errLines().size());
        assertEquals(3, output.outLines().size());
    }

    @Test
    @DisplayName("Range failures print one indented line per differing index")
    void testRangeFailureOutput() {
        ScriptedSuite<String> suite = new ScriptedSuite<>(String.class);
        suite.test("chars", () ->
                suite.assertArraysAreEqual("abc".chars().toArray(), new int[]{'a', 'x', 'c'}, 0, 3));

        runner.run(suite);

        assertEquals(1, output.counter.count());
        List<String> errors = output.errLines();
        assertEquals(2, errors.size());
        assertTrue(errors.get(0).endsWith("Assertion failed! ❌ "), errors.get(0));
        assertEquals("\t\t- 120 expected at index #1; got 98", errors.get(1));
    }

    @Test
    @DisplayName("With RECORD an exception is reported as one failure and the run goes on")
    void testRecordPolicy() {
        List<String> executed = new ArrayList<>();
        ScriptedSuite<String> suite = new ScriptedSuite<>(String.class)
                .test("charAt", () -> {
                    executed.add("charAt");
                    "".charAt(3);
                })
                .test("trim", () -> executed.add("trim"));

        runner.run(suite);

        assertEquals(List.of("charAt", "trim"), executed);
        assertEquals(1, output.counter.count());
        String line = output.errLines().get(0);
        assertTrue(line.contains(" Unexpected exception! ❌ java.lang.StringIndexOutOfBoundsException"), line);
        assertEquals("", output.outLines().get(output.outLines().size() - 1));
    }

    @Test
    @DisplayName("Floating-point list and boxed array ranges pass within tolerance")
    void testFloatingRangeAssertions() {
        ScriptedSuite<String> suite = new ScriptedSuite<>(String.class);
        suite.test("sums", () -> {
            List<Double> sums = List.of(0.1 + 0.2, 0.7 + 0.1);
            suite.assertListsAreEqual(sums, List.of(0.3, 0.8), 0, 2);
            suite.assertArraysAreEqual(new Float[]{0.1f * 3}, new Float[]{0.3f}, 0, 1);
            suite.assertArraysAreEqual(new Double[]{0.1 + 0.2}, new Double[]{0.3}, 0, 1);
            suite.assertListsAreEqual(List.of(1.5), List.of(1.6), 0, 1);
        });

        runner.run(suite);

        assertEquals(1, output.counter.count());
        assertEquals(4, output.outLines().size());
        assertEquals("\t\t- 1.6 expected at index #0; got 1.5", output.errLines().get(1));
    }

    @Test
    @DisplayName("An exception whose toString throws is still recorded")
    void testExceptionWithBrokenToString() {
        List<String> executed = new ArrayList<>();
        ScriptedSuite<String> suite = new ScriptedSuite<>(String.class)
                .test("format", () -> {
                    throw new IllegalArgumentException() {
                        @Override
                        public String toString() {
                            throw new UnsupportedOperationException("no text");
                        }
                    };
                })
                .test("trim", () -> executed.add("trim"));

        assertDoesNotThrow(() -> runner.run(suite));

        assertEquals(List.of("trim"), executed);
        assertEquals(1, output.counter.count());
        String line = output.errLines().get(0);
        assertTrue(line.contains(" Unexpected exception! ❌ "), line);
        assertTrue(line.contains("toString threw UnsupportedOperationException"), line);
    }

    @Test
    @DisplayName("With PROPAGATE an exception ends the run")
    void testPropagatePolicy() {
        SuiteRunner propagating = new SuiteRunner(output.reporter(), UncaughtExceptionPolicy.PROPAGATE);
        List<String> executed = new ArrayList<>();
        ScriptedSuite<String> suite = new ScriptedSuite<>(String.class)
                .test("parse", () -> {
                    executed.add("parse");
                    throw new IllegalStateException("broken fixture");
                })
                .test("trim", () -> executed.add("trim"));

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> propagating.run(suite));

        assertEquals("broken fixture", thrown.getMessage());
        assertEquals(List.of("parse"), executed);
        assertEquals(0, output.counter.count());
        assertThrows(IllegalStateException.class, () -> suite.assertIsTrue(true));
    }

    @Test
    @DisplayName("Errors are never recorded as failures")
    void testErrorPropagates() {
        ScriptedSuite<String> suite = new ScriptedSuite<>(String.class)
                .test("recurse", () -> {
                    throw new StackOverflowError();
                });

        assertThrows(StackOverflowError.class, () -> runner.run(suite));
        assertEquals(0, output.counter.count());
    }

    @Test
    @DisplayName("Running a suite twice produces the same lines in the same order")
    void testDeterministicOrder() {
        ScriptedSuite<String> suite = new ScriptedSuite<>(String.class);
        suite.test("concat", () -> suite.assertAreEqual("a".concat("b"), "ab"))
             .test("repeat", () -> suite.assertAreEqual("ab".repeat(2), "abab"))
             .test("strip", () -> suite.assertAreEqual(" x ".strip(), "x"));

        runner.run(suite);
        String first = output.out();
        output.reset();
        runner.run(suite);

        assertEquals(first, output.out());
        assertEquals(4, output.outLines().size());
    }

    @Test
    @DisplayName("Running freezes the suite and unbinds its assertions afterwards")
    void testRunFreezesSuite() {
        ScriptedSuite<String> suite = new ScriptedSuite<>(String.class).test("trim", () -> {});
        runner.run(suite);

        assertTrue(suite.isFrozen());
        assertThrows(IllegalStateException.class, () -> suite.test("strip", () -> {}));
        assertThrows(IllegalStateException.class, () -> suite.assertIsTrue(true));
    }

    @Test
    @DisplayName("Constructor rejects missing collaborators")
    void testInvalidConstruction() {
        assertThrows(IllegalArgumentException.class, () -> new SuiteRunner(null));
        assertThrows(IllegalArgumentException.class, () -> new SuiteRunner(output.reporter(), null));
        assertThrows(IllegalArgumentException.class, () -> runner.run(null));
        assertEquals(UncaughtExceptionPolicy.RECORD, runner.getExceptionPolicy());
    }
}

package com.ethnicthv.btl;

import com.ethnicthv.btl.core.report.ConsoleStyle;
import com.ethnicthv.btl.core.report.FailureCounter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Launcher over generated suites")
public class BtlLauncherIntegrationTest {

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final FailureCounter counter = new FailureCounter();

    private BTL.Builder builder() {
        PrintStream sink = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        return BTL.builder()
                .output(sink, sink)
                .failureCounter(counter)
                .style(ConsoleStyle.PLAIN);
    }

    @Test
    @DisplayName("Named subjects run and pass")
    void testNamedSubjects() {
        int status = BtlLauncher.launch(builder(),
                new String[]{"com.ethnicthv.btl.demo.RunningStats", "com.ethnicthv.btl.demo.Vector3f"});

        assertEquals(0, status);
        String out = outBytes.toString(StandardCharsets.UTF_8);
        assertTrue(out.indexOf("RunningStats::") < out.indexOf("Vector3f::"), out);
        assertFalse(out.contains("Health::"), out);
    }

    @Test
    @DisplayName("All generated suites run without arguments")
    void testRunAll() {
        assertEquals(0, BtlLauncher.launch(builder(), new String[0]));
        assertEquals(0, counter.count());
    }

    @Test
    @DisplayName("A type without a suite is rejected")
    void testSubjectWithoutSuite() {
        assertEquals(BtlLauncher.EXIT_UNKNOWN_SUBJECT,
                BtlLauncher.launch(builder(), new String[]{"com.ethnicthv.btl.demo.SuiteAPIDemo"}));
        assertEquals("", outBytes.toString(StandardCharsets.UTF_8));
    }
}

package com.ethnicthv.btl.demo;

import com.ethnicthv.btl.BTL;
import com.ethnicthv.btl.core.report.ConsoleStyle;
import com.ethnicthv.btl.core.report.FailureCounter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Generated suite registry")
public class GeneratedSuitesTest {

    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;
    private FailureCounter counter;

    @BeforeEach
    void setUp() {
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
        counter = new FailureCounter();
    }

    private BTL build() {
        return BTL.builder()
                .output(new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                        new PrintStream(errBytes, true, StandardCharsets.UTF_8))
                .failureCounter(counter)
                .style(ConsoleStyle.PLAIN)
                .build();
    }

    private List<String> outLines() {
        String text = outBytes.toString(StandardCharsets.UTF_8);
        String[] parts = text.split("\\R", -1);
        return Arrays.asList(parts).subList(0, parts.length - 1);
    }

    @Test
    @DisplayName("Every @DescribeClass suite is registered, sorted by suite class name")
    void testRegistration() {
        BTL btl = build();

        assertEquals(List.of(HealthComponent.class, IntRingBuffer.class, RunningStats.class, Vector3f.class),
                btl.getRegistry().registeredSubjects());
        assertEquals("", errBytes.toString(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("All demo suites pass")
    void testAllSuitesPass() {
        BTL btl = build();
        btl.runAll();

        assertEquals("", errBytes.toString(StandardCharsets.UTF_8));
        assertFalse(btl.hasErrors());
        assertEquals(0, btl.exitCode());

        List<String> lines = outLines();
        assertEquals(45, lines.stream().filter(l -> l.endsWith(" OK!")).count());
        assertEquals(4, lines.stream().filter(String::isEmpty).count());
        assertEquals("\tHealth::HealthComponent() should start at full health and alive when constructed with a maximum OK!",
                lines.get(0));
        assertEquals("", lines.get(lines.size() - 1));
    }

    @Test
    @DisplayName("Suites keep declaration order and run identically twice")
    void testDeterministicOutput() {
        build().runAll();
        String first = outBytes.toString(StandardCharsets.UTF_8);
        outBytes.reset();
        build().runAll();

        assertEquals(first, outBytes.toString(StandardCharsets.UTF_8));

        List<String> ring = outLines().stream()
                .filter(l -> l.startsWith("\tIntRingBuffer::"))
                .map(l -> l.substring("\tIntRingBuffer::".length(), l.indexOf("()")))
                .distinct()
                .toList();
        assertEquals(List.of("push", "toArray", "pop"), ring);
    }

    @Test
    @DisplayName("A single subject can be run on its own")
    void testSingleSubject() {
        BTL btl = build();
        btl.run(Vector3f.class);

        List<String> lines = outLines();
        assertEquals(13, lines.size());
        assertTrue(lines.stream().limit(12).allMatch(l -> l.startsWith("\tVector3f::")));
        assertEquals(0, counter.count());
    }
}

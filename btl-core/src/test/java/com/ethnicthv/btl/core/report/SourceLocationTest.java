package com.ethnicthv.btl.core.report;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Source location")
public class SourceLocationTest {

    @Test
    @DisplayName("Capture returns the calling frame")
    void testCaptureCaller() {
        SourceLocation location = SourceLocation.capture(Set.of());
        assertEquals("SourceLocationTest.java", location.file());
        assertTrue(location.line() > 0);
    }

    @Test
    @DisplayName("Capture skips the listed library classes")
    void testCaptureSkipsLibraryFrames() {
        SourceLocation location = SourceLocation.capture(Set.of(SourceLocationTest.class));
        assertNotEquals("SourceLocationTest.java", location.file());
    }

    @Test
    @DisplayName("Throw site is the top frame of the exception")
    void testOfThrowable() {
        RuntimeException error = new RuntimeException();
        SourceLocation location = SourceLocation.of(error);
        assertEquals("SourceLocationTest.java", location.file());
        assertEquals(error.getStackTrace()[0].getLineNumber(), location.line());
    }

    @Test
    @DisplayName("An exception without stack trace has an unknown location")
    void testOfThrowableWithoutTrace() {
        RuntimeException error = new RuntimeException();
        error.setStackTrace(new StackTraceElement[0]);
        assertSame(SourceLocation.UNKNOWN, SourceLocation.of(error));
    }

    @Test
    @DisplayName("Rendered as File.java(line)")
    void testToString() {
        assertEquals("Vector3fSuite.java(42)", new SourceLocation("Vector3fSuite.java", 42).toString());
        assertEquals("<unknown>(-1)", SourceLocation.UNKNOWN.toString());
    }
}

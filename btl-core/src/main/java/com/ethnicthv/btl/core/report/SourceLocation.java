package com.ethnicthv.btl.core.report;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * File and line of an assertion call site.
 */
public record SourceLocation(String file, int line) {

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", -1);

    private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

    public SourceLocation {
        Objects.requireNonNull(file, "file");
    }

    /**
     * Location of the first caller frame whose declaring class is not one of
     * {@code libraryClasses}.
     */
    public static SourceLocation capture(Set<Class<?>> libraryClasses) {
        Optional<StackWalker.StackFrame> frame = WALKER.walk(frames -> frames
                .filter(f -> f.getDeclaringClass() != SourceLocation.class)
                .filter(f -> !libraryClasses.contains(f.getDeclaringClass()))
                .findFirst());
        return frame.map(SourceLocation::of).orElse(UNKNOWN);
    }

    /** Throw site of {@code error}, i.e. its top stack frame. */
    public static SourceLocation of(Throwable error) {
        StackTraceElement[] trace = error.getStackTrace();
        if (trace.length == 0) return UNKNOWN;
        String file = trace[0].getFileName();
        return new SourceLocation(file == null ? trace[0].getClassName() : file, trace[0].getLineNumber());
    }

    private static SourceLocation of(StackWalker.StackFrame frame) {
        String file = frame.getFileName();
        return new SourceLocation(file == null ? frame.getClassName() : file, frame.getLineNumber());
    }

    @Override
    public String toString() {
        return file + "(" + line + ")";
    }
}

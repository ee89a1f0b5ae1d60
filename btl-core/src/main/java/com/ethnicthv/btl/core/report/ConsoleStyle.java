package com.ethnicthv.btl.core.report;

import java.util.Objects;

/**
 * Escape sequences wrapped around the parts of a report line.
 * Use {@link #PLAIN} when the output is not a terminal.
 */
public record ConsoleStyle(String location,
                           String failure,
                           String normal,
                           String normalBold,
                           String success,
                           String subject) {

    public ConsoleStyle {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(failure, "failure");
        Objects.requireNonNull(normal, "normal");
        Objects.requireNonNull(normalBold, "normalBold");
        Objects.requireNonNull(success, "success");
        Objects.requireNonNull(subject, "subject");
    }

    public static final ConsoleStyle ANSI = new ConsoleStyle(
            "\033[94;1m",
            "\033[91m",
            "\033[0m",
            "\033[0;1m",
            "\033[92;1m",
            "\033[95;1m");

    public static final ConsoleStyle PLAIN = new ConsoleStyle("", "", "", "", "", "");

    /**
     * Style for the launcher: {@link #PLAIN} when the {@code btl.color} system property is
     * {@code false} or {@code NO_COLOR} is set in the environment, otherwise {@link #ANSI}.
     */
    public static ConsoleStyle fromEnvironment() {
        String prop = System.getProperty("btl.color");
        if (prop != null) {
            return Boolean.parseBoolean(prop) ? ANSI : PLAIN;
        }
        String noColor = System.getenv("NO_COLOR");
        return noColor != null && !noColor.isEmpty() ? PLAIN : ANSI;
    }
}

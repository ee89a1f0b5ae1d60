package com.ethnicthv.btl.core.api;

import com.ethnicthv.btl.core.report.ConsoleStyle;

/**
 * Narrative of one test case: which operation, in what situation, with what expected outcome.
 * Renders as {@code method() should <expectation> when <situation>}.
 */
public record Description(String method, String situation, String expectation) {

    public Description {
        requireText(method, "method");
        requireText(situation, "situation");
        requireText(expectation, "expectation");
    }

    private static void requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " must not be null or blank");
        }
    }

    public String render(ConsoleStyle style) {
        return style.normalBold() + method + "()" + style.normal()
                + " should " + expectation + " when " + situation;
    }

    @Override
    public String toString() {
        return render(ConsoleStyle.PLAIN);
    }
}

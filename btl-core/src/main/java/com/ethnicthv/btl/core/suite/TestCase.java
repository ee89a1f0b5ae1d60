package com.ethnicthv.btl.core.suite;

import com.ethnicthv.btl.core.api.Description;

import java.util.Objects;

/**
 * One declared behaviour check: its description and the zero-argument body that performs
 * the assertions.
 */
public record TestCase(Description description, Runnable procedure) {

    public TestCase {
        Objects.requireNonNull(description, "description");
        if (procedure == null) {
            throw new IllegalArgumentException("Test procedure cannot be null for " + description);
        }
    }
}

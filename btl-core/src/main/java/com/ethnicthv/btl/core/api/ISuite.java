package com.ethnicthv.btl.core.api;

import com.ethnicthv.btl.core.suite.TestCase;

import java.util.List;

/**
 * Read-only view of the test suite declared for one subject type.
 *
 * @param <T> subject type
 */
public interface ISuite<T> {

    /** The type under test. */
    Class<T> subject();

    /** Display name, fixed at declaration. */
    String name();

    /** Declared test cases, in declaration order, which is also execution order. */
    List<TestCase> tests();
}

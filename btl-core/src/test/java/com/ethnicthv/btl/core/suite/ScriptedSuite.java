package com.ethnicthv.btl.core.suite;

/**
 * Suite whose test cases are added from outside, for driving the runner and registry in tests.
 */
final class ScriptedSuite<T> extends TestSuite<T> {

    ScriptedSuite(Class<T> subject) {
        super(subject);
    }

    ScriptedSuite(Class<T> subject, String name) {
        super(subject, name);
    }

    ScriptedSuite<T> test(String method, Runnable body) {
        return test(method, "it is called", "behave", body);
    }

    ScriptedSuite<T> test(String method, String situation, String expectation, Runnable body) {
        describeTest(method, situation, expectation, body);
        return this;
    }
}

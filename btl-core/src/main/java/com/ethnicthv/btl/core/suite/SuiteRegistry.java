package com.ethnicthv.btl.core.suite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * SuiteRegistry - one test suite per subject type.
 * <p>
 * A subject type is registered once with a factory; the suite is built on the first
 * {@link #get(Class)} and the same instance is returned afterwards. Registration order
 * is kept and is the order {@link #registeredSubjects()} reports.
 */
public class SuiteRegistry {

    private final Map<Class<?>, Registration<?>> registrations = new LinkedHashMap<>();

    private static final class Registration<T> {
        final Supplier<? extends TestSuite<T>> factory;
        TestSuite<T> built;

        Registration(Supplier<? extends TestSuite<T>> factory) {
            this.factory = factory;
        }
    }

    /**
     * Register the suite factory for {@code subject}.
     *
     * @throws IllegalArgumentException   if either argument is null
     * @throws SuiteDeclarationException if {@code subject} is already registered
     */
    public <T> void register(Class<T> subject, Supplier<? extends TestSuite<T>> factory) {
        if (subject == null) {
            throw new IllegalArgumentException("Subject type cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("Suite factory cannot be null for " + subject.getName());
        }
        if (registrations.containsKey(subject)) {
            throw new SuiteDeclarationException("A suite is already registered for " + subject.getName());
        }
        registrations.put(subject, new Registration<>(factory));
    }

    public boolean isRegistered(Class<?> subject) {
        return registrations.containsKey(subject);
    }

    /**
     * The suite for {@code subject}, built and frozen on first request.
     *
     * @throws SuiteDeclarationException if no suite is registered for {@code subject}, or building it
     *                                   failed or produced a suite for another subject
     */
    public <T> TestSuite<T> get(Class<T> subject) {
        @SuppressWarnings("unchecked")
        Registration<T> reg = (Registration<T>) registrations.get(subject);
        if (reg == null) {
            throw new SuiteDeclarationException("No suite registered for "
                    + (subject == null ? "null" : subject.getName()));
        }
        if (reg.built == null) {
            reg.built = build(subject, reg.factory);
        }
        return reg.built;
    }

    /** Registered subject types, in registration order. */
    public List<Class<?>> registeredSubjects() {
        return Collections.unmodifiableList(new ArrayList<>(registrations.keySet()));
    }

    public int size() {
        return registrations.size();
    }

    private static <T> TestSuite<T> build(Class<T> subject, Supplier<? extends TestSuite<T>> factory) {
        TestSuite<T> suite;
        try {
            suite = factory.get();
        } catch (RuntimeException ex) {
            throw new SuiteDeclarationException("Failed to build suite for " + subject.getName(), ex);
        }
        if (suite == null) {
            throw new SuiteDeclarationException("Suite factory for " + subject.getName() + " returned null");
        }
        if (suite.subject() != subject) {
            throw new SuiteDeclarationException("Suite " + suite.getClass().getName() + " tests "
                    + suite.subject().getName() + " but was registered for " + subject.getName());
        }
        suite.freeze();
        return suite;
    }
}

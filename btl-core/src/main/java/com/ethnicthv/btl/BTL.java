package com.ethnicthv.btl;

import com.ethnicthv.btl.core.report.ConsoleStyle;
import com.ethnicthv.btl.core.report.FailureCounter;
import com.ethnicthv.btl.core.report.Reporter;
import com.ethnicthv.btl.core.suite.SuiteRegistry;
import com.ethnicthv.btl.core.suite.SuiteRunner;
import com.ethnicthv.btl.core.suite.TestSuite;
import com.ethnicthv.btl.core.suite.UncaughtExceptionPolicy;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * BTL - the single entry point (Facade) for declaring and running test suites.
 * <p>
 * Wraps SuiteRegistry, SuiteRunner and Reporter into a unified API.
 * Provides a Builder for configuring output, colours, the failure counter and
 * the exception policy.
 */
public final class BTL {

    static final String GENERATED_SUITES = "com.ethnicthv.btl.generated.GeneratedSuites";

    private final SuiteRegistry registry;
    private final SuiteRunner runner;

    // Private constructor, use BTL.builder() instead.
    private BTL(SuiteRegistry registry, SuiteRunner runner) {
        this.registry = registry;
        this.runner = runner;
    }

    /**
     * Create a new Builder instance to configure the test run.
     */
    public static Builder builder() {
        return new Builder();
    }

    // =================================================================
    // Public API Delegates
    // =================================================================

    /**
     * Run the suite registered for {@code subject}, building it first if this is the
     * first request for it.
     *
     * @throws com.ethnicthv.btl.core.suite.SuiteDeclarationException if no suite is registered for the subject
     */
    public <T> void run(Class<T> subject) {
        runner.run(registry.get(subject));
    }

    /**
     * Run every registered suite, in registration order.
     */
    public void runAll() {
        for (Class<?> subject : registry.registeredSubjects()) {
            run(subject);
        }
    }

    /**
     * Whether any assertion reported through this instance's counter has failed.
     * With the default counter this is process-wide.
     */
    public boolean hasErrors() {
        return runner.getReporter().counter().hasFailures();
    }

    public long failureCount() {
        return runner.getReporter().counter().count();
    }

    /**
     * Conventional process exit status: {@code 1} when any failure was recorded, else {@code 0}.
     */
    public int exitCode() {
        return hasErrors() ? 1 : 0;
    }

    /**
     * Access the underlying SuiteRegistry for advanced operations.
     */
    public SuiteRegistry getRegistry() {
        return registry;
    }

    public SuiteRunner getRunner() {
        return runner;
    }

    // =================================================================
    // Builder Implementation
    // =================================================================

    public static class Builder {
        private final List<SuiteRegistration<?>> suites = new ArrayList<>();
        private FailureCounter counter = FailureCounter.global();
        private PrintStream out = System.out;
        private PrintStream err = System.err;
        private ConsoleStyle style = ConsoleStyle.ANSI;
        private UncaughtExceptionPolicy exceptionPolicy = UncaughtExceptionPolicy.RECORD;
        private boolean autoRegisterSuites = true;

        record SuiteRegistration<T>(Class<T> subject, Supplier<? extends TestSuite<T>> factory) {}

        /**
         * Disable automatic registration of suites found by the Annotation Processor.
         * Use this to run only manually registered suites.
         */
        public Builder noAutoRegistration() {
            this.autoRegisterSuites = false;
            return this;
        }

        /**
         * Manually register the suite for a subject type.
         */
        public <T> Builder registerSuite(Class<T> subject, Supplier<? extends TestSuite<T>> factory) {
            suites.add(new SuiteRegistration<>(subject, factory));
            return this;
        }

        /**
         * Counter that failed assertions are added to. Defaults to {@link FailureCounter#global()}.
         */
        public Builder failureCounter(FailureCounter counter) {
            if (counter == null) throw new IllegalArgumentException("counter must not be null");
            this.counter = counter;
            return this;
        }

        /**
         * Streams for passed (out) and failed (err) assertion lines.
         */
        public Builder output(PrintStream out, PrintStream err) {
            if (out == null || err == null) throw new IllegalArgumentException("output streams must not be null");
            this.out = out;
            this.err = err;
            return this;
        }

        public Builder style(ConsoleStyle style) {
            if (style == null) throw new IllegalArgumentException("style must not be null");
            this.style = style;
            return this;
        }

        public Builder exceptionPolicy(UncaughtExceptionPolicy policy) {
            if (policy == null) throw new IllegalArgumentException("policy must not be null");
            this.exceptionPolicy = policy;
            return this;
        }

        /**
         * Build the test run.
         * This will:
         * 1. Auto-register suites (if enabled).
         * 2. Register manually added suites.
         * 3. Create the Reporter and SuiteRunner.
         */
        public BTL build() {
            SuiteRegistry registry = new SuiteRegistry();

            // 1. Auto-register suites via generated code
            if (autoRegisterSuites) {
                try {
                    // Use reflection to avoid hard dependency on the generated class at compile time.
                    Class<?> gen = Class.forName(GENERATED_SUITES, false, getClass().getClassLoader());
                    java.lang.reflect.Method m = gen.getMethod("registerAll", SuiteRegistry.class);
                    m.invoke(null, registry);
                } catch (ClassNotFoundException e) {
                    // No @DescribeClass suite was compiled with the processor on the path.
                    err.println("[BTL] Warning: 'GeneratedSuites' class not found. " +
                            "Automatic suite registration skipped. " +
                            "Ensure annotation processing is enabled and the project is built.");
                } catch (ReflectiveOperationException e) {
                    throw new IllegalStateException("Failed to invoke GeneratedSuites.registerAll", e);
                }
            }

            // 2. Manual registrations (duplicates of generated ones are rejected by the registry)
            for (SuiteRegistration<?> reg : suites) {
                register(registry, reg);
            }

            // 3. Reporting + runner
            Reporter reporter = new Reporter(counter, out, err, style);
            return new BTL(registry, new SuiteRunner(reporter, exceptionPolicy));
        }

        private static <T> void register(SuiteRegistry registry, SuiteRegistration<T> reg) {
            registry.register(reg.subject(), reg.factory());
        }
    }
}

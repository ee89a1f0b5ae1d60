package com.ethnicthv.btl.core.suite.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@code TestSuite} subclass for compile-time discovery.
 * <p>
 * The annotation processor collects every annotated suite into
 * {@code com.ethnicthv.btl.generated.GeneratedSuites}, whose {@code registerAll(SuiteRegistry)}
 * registers each one against {@link #value()}. Constraints: the suite must be a public,
 * non-abstract top-level or static nested class with a public no-argument constructor,
 * and must extend {@code TestSuite<V>} where {@code V} is {@link #value()}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface DescribeClass {
    /** The subject type the suite tests. */
    Class<?> value();
}

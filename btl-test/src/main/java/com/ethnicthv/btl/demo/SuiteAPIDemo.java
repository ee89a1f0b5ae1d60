package com.ethnicthv.btl.demo;

import com.ethnicthv.btl.BTL;
import com.ethnicthv.btl.core.report.ConsoleStyle;

/**
 * Demo running the @DescribeClass suites of this module through the {@link BTL} facade.
 * Suites are registered by the generated GeneratedSuites; the process exits non-zero
 * when any assertion failed.
 */
public class SuiteAPIDemo {

    public static void main(String[] args) {
        BTL btl = BTL.builder()
                .style(ConsoleStyle.fromEnvironment())
                .build();

        System.out.println("Running " + btl.getRegistry().size() + " suites...\n");

        long startTime = System.nanoTime();
        btl.runAll();
        long totalTime = System.nanoTime() - startTime;

        System.out.printf("Suites finished in %.2f ms, %d failed assertions%n",
                totalTime / 1_000_000.0, btl.failureCount());
        System.exit(btl.exitCode());
    }
}

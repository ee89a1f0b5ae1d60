package com.ethnicthv.btl.demo;

import com.ethnicthv.btl.core.suite.TestSuite;
import com.ethnicthv.btl.core.suite.annotation.DescribeClass;

import java.util.ArrayList;
import java.util.List;

@DescribeClass(RunningStats.class)
public final class RunningStatsSuite extends TestSuite<RunningStats> {

    public RunningStatsSuite() {
        super(RunningStats.class);

        describeTest("mean", "no samples were added", "return zero", () -> {
            RunningStats stats = new RunningStats();
            assertAreEqual(stats.count(), 0L);
            assertAreEqual(stats.mean(), 0.0);
            assertAreEqual(stats.variance(), 0.0);
        });

        describeTest("variance", "a textbook sample is added", "match the population variance", () -> {
            RunningStats stats = new RunningStats();
            for (double v : new double[]{2, 4, 4, 4, 5, 5, 7, 9}) stats.add(v);
            assertAreEqual(stats.count(), 8L);
            assertAreEqual(stats.mean(), 5.0);
            assertAreEqual(stats.variance(), 4.0);
            assertAreEqual(stats.standardDeviation(), 2.0);
        });

        describeTest("mean", "tenths accumulate rounding error", "match within double tolerance", () -> {
            RunningStats stats = new RunningStats();
            for (int i = 0; i < 10; i++) stats.add(0.1);
            assertAreEqual(stats.mean(), 0.1);
        });

        describeTest("add", "means are recorded after each sample", "produce the running means", () -> {
            RunningStats stats = new RunningStats();
            List<Double> means = new ArrayList<>();
            for (double v : new double[]{1, 2, 3}) {
                stats.add(v);
                means.add(stats.mean());
            }
            assertListsAreEqual(means, List.of(1.0, 1.5, 2.0), 0, 3);
        });

        describeTest("add", "samples are not exactly representable", "track the means within double tolerance", () -> {
            RunningStats stats = new RunningStats();
            List<Double> means = new ArrayList<>();
            for (double v : new double[]{0.1, 0.2, 0.3}) {
                stats.add(v);
                means.add(stats.mean());
            }
            assertListsAreEqual(means, List.of(0.1, 0.15, 0.2), 0, 3);
        });
    }
}

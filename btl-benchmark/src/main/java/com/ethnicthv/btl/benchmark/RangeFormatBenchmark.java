package com.ethnicthv.btl.benchmark;

import com.ethnicthv.btl.core.compare.IndexedComparison;
import com.ethnicthv.btl.core.report.DiagnosticFormatter;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.TimeUnit;

/**
 * Cost of a range assertion's detail construction when every index matches (the common,
 * passing case) vs when a given share of the indices differ.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 1, jvmArgs = {"-Xms512M", "-Xmx512M"})
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@State(Scope.Thread)
public class RangeFormatBenchmark {

    @Param({"1000", "100000"})
    public int length;

    @Param({"0", "10"})
    public int mismatchPercent;

    private IndexedComparison ints;
    private IndexedComparison doubles;

    @Setup(Level.Trial)
    public void setup() {
        int[] expectedInts = new int[length];
        int[] actualInts = new int[length];
        double[] expectedDoubles = new double[length];
        double[] actualDoubles = new double[length];
        int every = mismatchPercent == 0 ? Integer.MAX_VALUE : 100 / mismatchPercent;
        for (int i = 0; i < length; i++) {
            expectedInts[i] = i;
            actualInts[i] = i % every == every - 1 ? -i : i;
            expectedDoubles[i] = i / 3.0;
            actualDoubles[i] = i % every == every - 1 ? -1.0 : i / 3.0;
        }
        ints = IndexedComparison.of(expectedInts, actualInts);
        doubles = IndexedComparison.of(expectedDoubles, actualDoubles);
    }

    @Benchmark
    public String intRange() {
        return DiagnosticFormatter.formatRangeFailure(ints, 0, length);
    }

    @Benchmark
    public String doubleRange() {
        return DiagnosticFormatter.formatRangeFailure(doubles, 0, length);
    }
}

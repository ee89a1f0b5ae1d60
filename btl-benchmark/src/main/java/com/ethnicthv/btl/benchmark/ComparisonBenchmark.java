package com.ethnicthv.btl.benchmark;

import com.ethnicthv.btl.core.compare.Comparisons;
import com.ethnicthv.btl.core.compare.Equality;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

/**
 * Microbenchmarks of the comparison engine:
 * - exact int comparison vs float/double tolerance comparison (statically dispatched).
 * - the same tolerance comparison through the boxed {@link Equality} strategy.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Fork(value = 1, jvmArgs = {"-Xms512M", "-Xmx512M"})
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@State(Scope.Thread)
public class ComparisonBenchmark {

    @Param({"1024"})
    public int size;

    private int[] ints;
    private float[] floats;
    private double[] doubles;
    private Float[] boxedFloats;

    private final Equality<Float> floatEquality = Equality.floatTolerance();

    @Setup(Level.Trial)
    public void setup() {
        ints = new int[size];
        floats = new float[size];
        doubles = new double[size];
        boxedFloats = new Float[size];
        for (int i = 0; i < size; i++) {
            ints[i] = i;
            floats[i] = i * 0.1f;
            doubles[i] = i * 0.1;
            boxedFloats[i] = floats[i];
        }
    }

    @Benchmark
    public void exactInt(Blackhole bh) {
        for (int i = 1; i < size; i++) {
            bh.consume(Comparisons.areEqual(ints[i - 1], ints[i]));
        }
    }

    @Benchmark
    public void floatTolerance(Blackhole bh) {
        for (int i = 1; i < size; i++) {
            bh.consume(Comparisons.areEqual(floats[i - 1], floats[i]));
        }
    }

    @Benchmark
    public void doubleTolerance(Blackhole bh) {
        for (int i = 1; i < size; i++) {
            bh.consume(Comparisons.areEqual(doubles[i - 1], doubles[i]));
        }
    }

    @Benchmark
    public void boxedFloatStrategy(Blackhole bh) {
        for (int i = 1; i < size; i++) {
            bh.consume(floatEquality.areEqual(boxedFloats[i - 1], boxedFloats[i]));
        }
    }
}

package com.ethnicthv.btl.demo;

/**
 * Streaming mean and variance (Welford's algorithm).
 */
public class RunningStats {
    private long count;
    private double mean;
    private double m2;

    public void add(double value) {
        count++;
        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);
    }

    public long count() {
        return count;
    }

    public double mean() {
        return count == 0 ? 0.0 : mean;
    }

    /** Population variance; 0 for fewer than two samples. */
    public double variance() {
        return count < 2 ? 0.0 : m2 / count;
    }

    public double standardDeviation() {
        return Math.sqrt(variance());
    }
}

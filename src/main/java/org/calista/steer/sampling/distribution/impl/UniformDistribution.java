package org.calista.steer.sampling.distribution.impl;

import org.calista.steer.sampling.distribution.Distribution;

import java.util.Map;
import java.util.random.RandomGenerator;

/** Continuous uniform on [lower, upper). */
public final class UniformDistribution implements Distribution<Double> {

    private final double lower;
    private final double upper;
    private final double logDensity;

    public UniformDistribution(double lower, double upper) {
        if (!Double.isFinite(lower) || !Double.isFinite(upper) || !(lower < upper)) {
            throw new IllegalArgumentException("Require finite lower < upper, got [" + lower + ", " + upper + ")");
        }
        this.lower = lower;
        this.upper = upper;
        this.logDensity = -Math.log(upper - lower);
    }

    @Override
    public Double sample(RandomGenerator rng) {
        return lower + (upper - lower) * rng.nextDouble();
    }

    @Override
    public double logPdf(Double x) {
        if (x == null || Double.isNaN(x)) return Double.NEGATIVE_INFINITY;
        return (x >= lower && x < upper) ? logDensity : Double.NEGATIVE_INFINITY;
    }

    public double lower() { return lower; }

    public double upper() { return upper; }

    @Override
    public String name() {
        return "uniform";
    }

    @Override
    public Map<String, Object> parameters() {
        return Map.of("lower", lower, "upper", upper);
    }

    @Override
    public String toString() {
        return "Uniform[" + lower + ", " + upper + ")";
    }
}

package org.calista.steer.sampling.distribution.impl;

import org.calista.steer.sampling.distribution.Distribution;

import java.util.Map;
import java.util.random.RandomGenerator;

public final class GaussianDistribution implements Distribution<Double> {

    private static final double LOG_SQRT_2PI = 0.5 * Math.log(2.0 * Math.PI);

    private final double mean;
    private final double stdDev;
    private final double logStdDev;

    public GaussianDistribution(double mean, double stdDev) {
        if (!Double.isFinite(mean)) throw new IllegalArgumentException("mean must be finite: " + mean);
        if (!(stdDev > 0.0) || !Double.isFinite(stdDev)) {
            throw new IllegalArgumentException("stdDev must be > 0: " + stdDev);
        }
        this.mean = mean;
        this.stdDev = stdDev;
        this.logStdDev = Math.log(stdDev);
    }

    public static GaussianDistribution standard() {
        return new GaussianDistribution(0.0, 1.0);
    }

    @Override
    public Double sample(RandomGenerator rng) {
        return mean + stdDev * rng.nextGaussian();
    }

    @Override
    public double logPdf(Double x) {
        if (x == null || Double.isNaN(x)) return Double.NEGATIVE_INFINITY;
        double z = (x - mean) / stdDev;
        return -0.5 * z * z - logStdDev - LOG_SQRT_2PI;
    }

    public double mean() { return mean; }

    public double stdDev() { return stdDev; }

    @Override
    public String name() {
        return "gaussian";
    }

    @Override
    public Map<String, Object> parameters() {
        return Map.of("mean", mean, "stdDev", stdDev);
    }

    @Override
    public String toString() {
        return "Gaussian(" + mean + ", " + stdDev + ")";
    }
}

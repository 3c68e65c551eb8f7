package org.calista.steer.sampling.mcmc.impl;

import org.calista.steer.sampling.mcmc.ProposalKernel;

import java.util.random.RandomGenerator;

/**
 * Multiplicative random walk for positive values: x' = x · exp(N(0, scale²)).
 * Asymmetric, so the Hastings correction applies.
 */
public final class LogNormalProposal implements ProposalKernel<Double> {

    private static final double LOG_SQRT_2PI = 0.5 * Math.log(2.0 * Math.PI);

    private final double scale;

    public LogNormalProposal(double scale) {
        if (!(scale > 0.0) || !Double.isFinite(scale)) throw new IllegalArgumentException("scale must be > 0: " + scale);
        this.scale = scale;
    }

    @Override
    public Double propose(Double current, RandomGenerator rng) {
        if (!(current > 0.0)) throw new IllegalArgumentException("LogNormalProposal needs a positive state, got " + current);
        return current * Math.exp(scale * rng.nextGaussian());
    }

    @Override
    public double logDensity(Double to, Double from) {
        if (!(to > 0.0) || !(from > 0.0)) return Double.NEGATIVE_INFINITY;
        double z = (Math.log(to) - Math.log(from)) / scale;
        return -0.5 * z * z - Math.log(scale) - LOG_SQRT_2PI - Math.log(to);
    }
}

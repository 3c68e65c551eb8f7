package org.calista.steer.sampling.mcmc.impl;

import org.calista.steer.sampling.mcmc.ProposalKernel;

import java.util.random.RandomGenerator;

/** Random walk x' = x + N(0, scale²). Symmetric. */
public final class GaussianProposal implements ProposalKernel<Double> {

    private static final double LOG_SQRT_2PI = 0.5 * Math.log(2.0 * Math.PI);

    private final double scale;

    public GaussianProposal(double scale) {
        if (!(scale > 0.0) || !Double.isFinite(scale)) throw new IllegalArgumentException("scale must be > 0: " + scale);
        this.scale = scale;
    }

    @Override
    public Double propose(Double current, RandomGenerator rng) {
        return current + scale * rng.nextGaussian();
    }

    @Override
    public double logDensity(Double to, Double from) {
        double z = (to - from) / scale;
        return -0.5 * z * z - Math.log(scale) - LOG_SQRT_2PI;
    }

    @Override
    public boolean symmetric() {
        return true;
    }

    public double scale() {
        return scale;
    }
}

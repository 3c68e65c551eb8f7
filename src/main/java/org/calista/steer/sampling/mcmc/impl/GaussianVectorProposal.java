package org.calista.steer.sampling.mcmc.impl;

import org.calista.steer.sampling.mcmc.ProposalKernel;

import java.util.random.RandomGenerator;

/** Isotropic random walk over double[]. Symmetric. */
public final class GaussianVectorProposal implements ProposalKernel<double[]> {

    private static final double LOG_SQRT_2PI = 0.5 * Math.log(2.0 * Math.PI);

    private final double scale;

    public GaussianVectorProposal(double scale) {
        if (!(scale > 0.0) || !Double.isFinite(scale)) throw new IllegalArgumentException("scale must be > 0: " + scale);
        this.scale = scale;
    }

    @Override
    public double[] propose(double[] current, RandomGenerator rng) {
        double[] out = new double[current.length];
        for (int i = 0; i < out.length; i++) out[i] = current[i] + scale * rng.nextGaussian();
        return out;
    }

    @Override
    public double logDensity(double[] to, double[] from) {
        double acc = 0.0;
        for (int i = 0; i < to.length; i++) {
            double z = (to[i] - from[i]) / scale;
            acc += -0.5 * z * z - Math.log(scale) - LOG_SQRT_2PI;
        }
        return acc;
    }

    @Override
    public boolean symmetric() {
        return true;
    }
}

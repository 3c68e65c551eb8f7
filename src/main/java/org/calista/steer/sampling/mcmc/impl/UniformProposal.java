package org.calista.steer.sampling.mcmc.impl;

import org.calista.steer.sampling.mcmc.ProposalKernel;

import java.util.random.RandomGenerator;

/** x' uniform on [x − halfWidth, x + halfWidth). Symmetric. */
public final class UniformProposal implements ProposalKernel<Double> {

    private final double halfWidth;

    public UniformProposal(double halfWidth) {
        if (!(halfWidth > 0.0) || !Double.isFinite(halfWidth)) {
            throw new IllegalArgumentException("halfWidth must be > 0: " + halfWidth);
        }
        this.halfWidth = halfWidth;
    }

    @Override
    public Double propose(Double current, RandomGenerator rng) {
        return current + halfWidth * (2.0 * rng.nextDouble() - 1.0);
    }

    @Override
    public double logDensity(Double to, Double from) {
        return (Math.abs(to - from) <= halfWidth) ? -Math.log(2.0 * halfWidth) : Double.NEGATIVE_INFINITY;
    }

    @Override
    public boolean symmetric() {
        return true;
    }
}

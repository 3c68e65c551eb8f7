package org.calista.steer.sampling.mcmc.impl;

import org.calista.steer.sampling.mcmc.ProposalKernel;

import java.util.random.RandomGenerator;

/**
 * Gaussian random walk whose scale follows the running acceptance rate towards a target
 * (0.234 by default): scale ← scale · exp(rate · (acceptance − target)).
 *
 * <p>The sampler only adapts during burn-in, so retained draws come from a fixed kernel.
 * Stateful; one instance per chain.</p>
 */
public final class AdaptiveProposal implements ProposalKernel<Double> {

    public static final double DEFAULT_TARGET_ACCEPTANCE = 0.234;
    public static final double DEFAULT_ADAPTATION_RATE = 0.01;

    private static final double LOG_SQRT_2PI = 0.5 * Math.log(2.0 * Math.PI);

    private final double targetAcceptance;
    private final double adaptationRate;

    private double scale;
    private long proposals;
    private long accepted;

    public AdaptiveProposal(double initialScale) {
        this(initialScale, DEFAULT_TARGET_ACCEPTANCE, DEFAULT_ADAPTATION_RATE);
    }

    public AdaptiveProposal(double initialScale, double targetAcceptance, double adaptationRate) {
        if (!(initialScale > 0.0)) throw new IllegalArgumentException("initialScale must be > 0: " + initialScale);
        if (!(targetAcceptance > 0.0 && targetAcceptance < 1.0)) {
            throw new IllegalArgumentException("targetAcceptance must be in (0,1): " + targetAcceptance);
        }
        if (!(adaptationRate >= 0.0)) throw new IllegalArgumentException("adaptationRate must be >= 0: " + adaptationRate);
        this.scale = initialScale;
        this.targetAcceptance = targetAcceptance;
        this.adaptationRate = adaptationRate;
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

    @Override
    public void adapt(boolean wasAccepted) {
        proposals++;
        if (wasAccepted) accepted++;
        double rate = (double) accepted / proposals;
        scale *= Math.exp(adaptationRate * (rate - targetAcceptance));
        // keep the kernel usable after long runs of rejections
        scale = Math.max(1e-12, Math.min(1e12, scale));
    }

    public double scale() {
        return scale;
    }

    public double observedAcceptance() {
        return (proposals == 0) ? 0.0 : (double) accepted / proposals;
    }
}

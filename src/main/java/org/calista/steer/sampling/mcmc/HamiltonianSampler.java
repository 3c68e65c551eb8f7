package org.calista.steer.sampling.mcmc;

import org.calista.steer.sampling.LogDensity;

import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Hamiltonian Monte Carlo with unit mass matrix.
 *
 * <p>Each transition draws a momentum p ~ N(0, I), runs {@code leapfrogSteps} leapfrog steps of
 * size {@code stepSize} and accepts with probability min(1, exp(H(x,p) − H(x',p'))), where
 * H = −log π(x) + |p|²/2.</p>
 */
public final class HamiltonianSampler extends MarkovChainSampler<double[]> {

    /** ∇ log π(x). */
    @FunctionalInterface
    public interface Gradient {
        double[] at(double[] x);
    }

    private final Gradient gradient;
    private final double stepSize;
    private final int leapfrogSteps;

    public HamiltonianSampler(LogDensity<double[]> target, Gradient gradient, double stepSize, int leapfrogSteps) {
        super(target);
        this.gradient = Objects.requireNonNull(gradient, "gradient");
        if (!(stepSize > 0.0) || !Double.isFinite(stepSize)) throw new IllegalArgumentException("stepSize must be > 0: " + stepSize);
        if (leapfrogSteps < 1) throw new IllegalArgumentException("leapfrogSteps must be >= 1: " + leapfrogSteps);
        this.stepSize = stepSize;
        this.leapfrogSteps = leapfrogSteps;
    }

    @Override
    protected Step<double[]> step(double[] current, double currentLogDensity, boolean inBurnIn, RandomGenerator rng) {
        int d = current.length;
        double[] x = current.clone();
        double[] p = new double[d];
        for (int i = 0; i < d; i++) p[i] = rng.nextGaussian();
        double kinetic0 = kinetic(p);

        double[] g = gradient.at(x);
        for (int i = 0; i < d; i++) p[i] += 0.5 * stepSize * g[i];
        for (int l = 0; l < leapfrogSteps; l++) {
            for (int i = 0; i < d; i++) x[i] += stepSize * p[i];
            g = gradient.at(x);
            double scale = (l == leapfrogSteps - 1) ? 0.5 * stepSize : stepSize;
            for (int i = 0; i < d; i++) p[i] += scale * g[i];
        }

        double lpNew = target.logDensity(x);
        if (lpNew == Double.NEGATIVE_INFINITY || Double.isNaN(lpNew)) {
            return new Step<>(x, lpNew, false);
        }
        // H_old - H_new
        double logRatio = (lpNew - kinetic(p)) - (currentLogDensity - kinetic0);
        return new Step<>(x, lpNew, accept(logRatio, rng));
    }

    private static double kinetic(double[] p) {
        double s = 0.0;
        for (double v : p) s += v * v;
        return 0.5 * s;
    }

    public double stepSize() {
        return stepSize;
    }

    public int leapfrogSteps() {
        return leapfrogSteps;
    }
}

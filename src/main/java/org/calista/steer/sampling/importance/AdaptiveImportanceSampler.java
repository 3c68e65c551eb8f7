package org.calista.steer.sampling.importance;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.steer.sampling.LogDensity;
import org.calista.steer.sampling.Weights;
import org.calista.steer.sampling.distribution.impl.MixtureDistribution;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Importance sampler whose mixture proposal re-weights its components every
 * {@code adaptationInterval} draws, moving mass towards components that explain high-weight draws.
 *
 * <p>Each draw is weighted against the proposal in force when it was drawn. Component weights
 * never drop below {@code minComponentWeight}, so a component can recover later.</p>
 *
 * <p>Not thread-safe: {@link #sample(int, RandomGenerator)} updates the current proposal.</p>
 */
public final class AdaptiveImportanceSampler<T> extends ImportanceSampler<T> {

    private static final Logger log = LogManager.getLogger(AdaptiveImportanceSampler.class);

    private final int adaptationInterval;
    private final double minComponentWeight;
    private MixtureDistribution<T> current;

    public AdaptiveImportanceSampler(MixtureDistribution<T> proposal, LogDensity<T> target, int adaptationInterval) {
        this(proposal, target, adaptationInterval, 1e-3);
    }

    public AdaptiveImportanceSampler(MixtureDistribution<T> proposal, LogDensity<T> target,
                                     int adaptationInterval, double minComponentWeight) {
        super(proposal, target);
        if (adaptationInterval < 1) throw new IllegalArgumentException("adaptationInterval must be >= 1: " + adaptationInterval);
        if (!(minComponentWeight >= 0.0 && minComponentWeight < 1.0)) {
            throw new IllegalArgumentException("minComponentWeight must be in [0,1): " + minComponentWeight);
        }
        this.adaptationInterval = adaptationInterval;
        this.minComponentWeight = minComponentWeight;
        this.current = proposal;
    }

    @Override
    public WeightedSamples<T> sample(int n, RandomGenerator rng) {
        if (n < 1) throw new IllegalArgumentException("n must be >= 1: " + n);

        ArrayList<T> xs = new ArrayList<>(n);
        double[] lw = new double[n];
        for (int i = 0; i < n; i++) {
            T x = current.sample(rng);
            xs.add(x);
            lw[i] = logWeight(x, current);

            if ((i + 1) % adaptationInterval == 0) {
                adapt(xs, Arrays.copyOf(lw, i + 1));
            }
        }
        return new WeightedSamples<>(xs, lw);
    }

    private void adapt(List<T> xs, double[] lw) {
        if (Weights.collapsed(lw)) {
            log.debug("adaptive.skip n={} reason=no_support", xs.size());
            return;
        }
        double[] w = Weights.normalize(lw);
        int k = current.components().size();
        double[] mass = new double[k];
        for (int i = 0; i < w.length; i++) {
            if (w[i] == 0.0) continue;
            double[] r = current.responsibilities(xs.get(i));
            for (int c = 0; c < k; c++) mass[c] += w[i] * r[c];
        }
        double total = 0.0;
        for (double m : mass) total += m;
        if (!(total > 0.0)) return;

        for (int c = 0; c < k; c++) mass[c] = Math.max(minComponentWeight, mass[c] / total);
        current = current.withWeights(mass);
        if (log.isDebugEnabled()) log.debug("adaptive.update n={} weights={}", xs.size(), Arrays.toString(current.weights()));
    }

    /** Proposal after the most recent adaptation. */
    public MixtureDistribution<T> currentProposal() {
        return current;
    }
}

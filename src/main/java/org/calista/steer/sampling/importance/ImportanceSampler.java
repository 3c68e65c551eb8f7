package org.calista.steer.sampling.importance;

import org.calista.steer.sampling.LogDensity;
import org.calista.steer.sampling.distribution.Distribution;

import java.util.ArrayList;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Self-normalized importance sampling: draws from a proposal q and weights each draw by π(x)/q(x).
 * Stateless apart from its two densities; safe to share.
 */
public class ImportanceSampler<T> {

    protected final LogDensity<T> target;
    private final Distribution<T> proposal;

    public ImportanceSampler(Distribution<T> proposal, LogDensity<T> target) {
        this.proposal = Objects.requireNonNull(proposal, "proposal");
        this.target = Objects.requireNonNull(target, "target");
    }

    public WeightedSamples<T> sample(int n, RandomGenerator rng) {
        if (n < 1) throw new IllegalArgumentException("n must be >= 1: " + n);
        Objects.requireNonNull(rng, "rng");

        ArrayList<T> xs = new ArrayList<>(n);
        double[] lw = new double[n];
        for (int i = 0; i < n; i++) {
            T x = proposal.sample(rng);
            xs.add(x);
            lw[i] = logWeight(x, proposal);
        }
        return new WeightedSamples<>(xs, lw);
    }

    protected final double logWeight(T x, Distribution<T> q) {
        double lq = q.logPdf(x);
        if (lq == Double.NEGATIVE_INFINITY) return Double.NEGATIVE_INFINITY;
        return target.logDensity(x) - lq;
    }

    public Distribution<T> proposal() {
        return proposal;
    }
}

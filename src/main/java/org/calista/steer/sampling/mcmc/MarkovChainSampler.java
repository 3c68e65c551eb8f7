package org.calista.steer.sampling.mcmc;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.steer.sampling.LogDensity;

import java.util.ArrayList;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Base class for Markov chain Monte Carlo samplers.
 *
 * <p>The chain runs {@code burnIn + numSamples·thin} transitions and keeps every
 * {@code thin}-th state after burn-in. Subclasses only implement a single transition.</p>
 */
public abstract class MarkovChainSampler<T> {

    private static final Logger log = LogManager.getLogger(MarkovChainSampler.class);

    protected final LogDensity<T> target;

    protected MarkovChainSampler(LogDensity<T> target) {
        this.target = Objects.requireNonNull(target, "target");
    }

    /** Outcome of one transition. */
    protected static final class Step<T> {
        final T state;
        final double logDensity;
        final boolean accepted;

        public Step(T state, double logDensity, boolean accepted) {
            this.state = state;
            this.logDensity = logDensity;
            this.accepted = accepted;
        }
    }

    /**
     * One transition from {@code current}.
     *
     * @param inBurnIn true while draws are being discarded; adaptive kernels may only adapt here
     */
    protected abstract Step<T> step(T current, double currentLogDensity, boolean inBurnIn, RandomGenerator rng);

    public ChainResult<T> sample(T initial, int numSamples, int burnIn, int thin, RandomGenerator rng) {
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(rng, "rng");
        if (numSamples < 0) throw new IllegalArgumentException("numSamples must be >= 0: " + numSamples);
        if (burnIn < 0) throw new IllegalArgumentException("burnIn must be >= 0: " + burnIn);
        if (thin < 1) throw new IllegalArgumentException("thin must be >= 1: " + thin);

        double lp = target.logDensity(initial);
        if (lp == Double.NEGATIVE_INFINITY || Double.isNaN(lp)) {
            throw new IllegalArgumentException("initial state has zero target density");
        }

        ArrayList<T> kept = new ArrayList<>(numSamples);
        long proposals = 0;
        long accepted = 0;

        T x = initial;
        long total = (long) burnIn + (long) numSamples * thin;
        for (long t = 1; t <= total; t++) {
            boolean inBurnIn = t <= burnIn;
            Step<T> s = step(x, lp, inBurnIn, rng);
            proposals++;
            if (s.accepted) {
                accepted++;
                x = s.state;
                lp = s.logDensity;
            }
            if (!inBurnIn && ((t - burnIn) % thin == 0)) kept.add(x);
        }

        ChainResult<T> r = new ChainResult<>(kept, proposals, accepted);
        if (log.isDebugEnabled()) {
            log.debug("mcmc.done sampler={} kept={} transitions={} acceptance={}",
                    getClass().getSimpleName(), kept.size(), total, String.format("%.3f", r.acceptanceRate()));
        }
        return r;
    }

    /** Metropolis acceptance test on a log ratio. */
    protected static boolean accept(double logRatio, RandomGenerator rng) {
        if (Double.isNaN(logRatio)) return false;
        if (logRatio >= 0.0) return true;
        return Math.log(rng.nextDouble()) < logRatio;
    }
}

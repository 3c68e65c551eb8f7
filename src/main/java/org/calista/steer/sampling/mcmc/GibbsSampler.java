package org.calista.steer.sampling.mcmc;

import org.calista.steer.sampling.LogDensity;

import java.util.List;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Systematic-scan Gibbs sampler over a double[] state. One transition redraws every coordinate
 * in order from its full conditional; transitions are always accepted.
 */
public final class GibbsSampler extends MarkovChainSampler<double[]> {

    /** Draws coordinate {@code index} given all other coordinates of {@code state}. */
    @FunctionalInterface
    public interface FullConditional {
        double sample(double[] state, int index, RandomGenerator rng);
    }

    private final List<FullConditional> conditionals;

    /** Without a target density only sampling is supported; diagnostics do not need it. */
    public GibbsSampler(List<FullConditional> conditionals) {
        this(x -> 0.0, conditionals);
    }

    public GibbsSampler(LogDensity<double[]> target, List<FullConditional> conditionals) {
        super(target);
        Objects.requireNonNull(conditionals, "conditionals");
        if (conditionals.isEmpty()) throw new IllegalArgumentException("conditionals must not be empty");
        this.conditionals = List.copyOf(conditionals);
    }

    @Override
    protected Step<double[]> step(double[] current, double currentLogDensity, boolean inBurnIn, RandomGenerator rng) {
        if (current.length != conditionals.size()) {
            throw new IllegalArgumentException("state has " + current.length + " coordinates, sampler has "
                    + conditionals.size() + " conditionals");
        }
        double[] next = current.clone();
        for (int i = 0; i < next.length; i++) {
            next[i] = conditionals.get(i).sample(next, i, rng);
        }
        return new Step<>(next, target.logDensity(next), true);
    }

    public int dimension() {
        return conditionals.size();
    }
}

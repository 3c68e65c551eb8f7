package org.calista.steer.sampling.distribution.impl;

import org.calista.steer.sampling.Weights;
import org.calista.steer.sampling.distribution.Distribution;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Finite mixture of component distributions over the same space.
 * Immutable; {@link #withWeights(double[])} returns a re-weighted copy.
 */
public final class MixtureDistribution<T> implements Distribution<T> {

    private final List<Distribution<T>> components;
    private final double[] weights;
    private final double[] logWeights;
    private final double[] cumulative;

    public MixtureDistribution(List<Distribution<T>> components, double[] weights) {
        Objects.requireNonNull(components, "components");
        if (components.isEmpty()) throw new IllegalArgumentException("components must not be empty");
        this.components = List.copyOf(components);

        double[] w = (weights == null) ? new double[components.size()] : weights.clone();
        if (weights == null) Arrays.fill(w, 1.0);
        if (w.length != components.size()) {
            throw new IllegalArgumentException("components/weights size mismatch: " + components.size() + " vs " + w.length);
        }
        double total = 0.0;
        for (double x : w) {
            if (!(x >= 0.0) || !Double.isFinite(x)) throw new IllegalArgumentException("mixture weight must be >= 0: " + x);
            total += x;
        }
        if (!(total > 0.0)) throw new IllegalArgumentException("mixture weights sum to zero");

        this.weights = new double[w.length];
        this.logWeights = new double[w.length];
        for (int i = 0; i < w.length; i++) {
            this.weights[i] = w[i] / total;
            this.logWeights[i] = (this.weights[i] > 0.0) ? Math.log(this.weights[i]) : Double.NEGATIVE_INFINITY;
        }
        this.cumulative = Weights.cumulative(this.weights);
    }

    public static <T> MixtureDistribution<T> equal(List<Distribution<T>> components) {
        return new MixtureDistribution<>(components, null);
    }

    @Override
    public T sample(RandomGenerator rng) {
        int k = Weights.search(cumulative, rng.nextDouble());
        return components.get(k).sample(rng);
    }

    @Override
    public double logPdf(T x) {
        double[] terms = new double[components.size()];
        for (int k = 0; k < terms.length; k++) {
            terms[k] = logWeights[k] + components.get(k).logPdf(x);
        }
        return Weights.logSumExp(terms);
    }

    /**
     * Posterior probability that x came from each component. All zeros when x lies outside
     * every component's support.
     */
    public double[] responsibilities(T x) {
        double[] terms = new double[components.size()];
        for (int k = 0; k < terms.length; k++) {
            terms[k] = logWeights[k] + components.get(k).logPdf(x);
        }
        if (Weights.collapsed(terms)) return new double[terms.length];
        return Weights.normalize(terms);
    }

    public MixtureDistribution<T> withWeights(double[] newWeights) {
        return new MixtureDistribution<>(components, newWeights);
    }

    public List<Distribution<T>> components() {
        return components;
    }

    public double[] weights() {
        return weights.clone();
    }

    @Override
    public String name() {
        return "mixture";
    }

    @Override
    public Map<String, Object> parameters() {
        return Map.of("components", components.size());
    }
}

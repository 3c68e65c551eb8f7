package org.calista.steer.sampling.distribution.impl;

import org.calista.steer.sampling.Weights;
import org.calista.steer.sampling.distribution.Distribution;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Categorical distribution over a finite set of values.
 *
 * <p>Probabilities are normalized on construction. Duplicate values are merged. Values keep
 * insertion order, which fixes the order of the cumulative table and therefore sampling
 * for a given generator state.</p>
 */
public final class DiscreteDistribution<T> implements Distribution<T> {

    private final List<T> values;
    private final double[] probabilities;
    private final double[] cumulative;
    private final Map<T, Integer> index;

    public DiscreteDistribution(List<T> values, double[] masses) {
        Objects.requireNonNull(values, "values");
        if (values.isEmpty()) throw new IllegalArgumentException("values must not be empty");

        double[] p = (masses == null) ? uniformMass(values.size()) : masses.clone();
        if (p.length != values.size()) {
            throw new IllegalArgumentException("values/probabilities size mismatch: " + values.size() + " vs " + p.length);
        }

        LinkedHashMap<T, Double> merged = new LinkedHashMap<>();
        double total = 0.0;
        for (int i = 0; i < p.length; i++) {
            double pi = p[i];
            if (!(pi >= 0.0) || !Double.isFinite(pi)) {
                throw new IllegalArgumentException("probability must be finite and >= 0, got " + pi + " at " + i);
            }
            merged.merge(Objects.requireNonNull(values.get(i), "value"), pi, Double::sum);
            total += pi;
        }
        if (!(total > 0.0)) throw new IllegalArgumentException("probabilities sum to zero");

        this.values = Collections.unmodifiableList(new ArrayList<>(merged.keySet()));
        this.probabilities = new double[this.values.size()];
        this.index = new LinkedHashMap<>();
        int i = 0;
        for (Map.Entry<T, Double> e : merged.entrySet()) {
            this.probabilities[i] = e.getValue() / total;
            index.put(e.getKey(), i);
            i++;
        }
        this.cumulative = Weights.cumulative(this.probabilities);
    }

    public static <T> DiscreteDistribution<T> uniform(List<T> values) {
        return new DiscreteDistribution<>(values, null);
    }

    public static <T> DiscreteDistribution<T> of(Map<T, Double> weights) {
        Objects.requireNonNull(weights, "weights");
        List<T> vs = new ArrayList<>(weights.keySet());
        double[] ps = new double[vs.size()];
        for (int i = 0; i < ps.length; i++) ps[i] = weights.get(vs.get(i));
        return new DiscreteDistribution<>(vs, ps);
    }

    @Override
    public T sample(RandomGenerator rng) {
        return values.get(Weights.search(cumulative, rng.nextDouble()));
    }

    @Override
    public double logPdf(T x) {
        Integer i = index.get(x);
        if (i == null) return Double.NEGATIVE_INFINITY;
        double p = probabilities[i];
        return (p > 0.0) ? Math.log(p) : Double.NEGATIVE_INFINITY;
    }

    public double probability(T x) {
        Integer i = index.get(x);
        return (i == null) ? 0.0 : probabilities[i];
    }

    public List<T> values() {
        return values;
    }

    public double[] probabilities() {
        return probabilities.clone();
    }

    public int size() {
        return values.size();
    }

    @Override
    public String name() {
        return "discrete";
    }

    @Override
    public Map<String, Object> parameters() {
        return Map.of("size", values.size());
    }

    private static double[] uniformMass(int n) {
        double[] p = new double[n];
        Arrays.fill(p, 1.0);
        return p;
    }

    @Override
    public String toString() {
        return "Discrete(" + values.size() + " values)";
    }
}

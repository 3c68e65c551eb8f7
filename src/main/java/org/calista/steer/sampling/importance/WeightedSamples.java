package org.calista.steer.sampling.importance;

import org.calista.steer.sampling.Weights;

import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Draws with their importance log-weights log π(x) − log q(x). Immutable.
 */
public final class WeightedSamples<T> {

    private final List<T> values;
    private final double[] logWeights;

    public WeightedSamples(List<T> values, double[] logWeights) {
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(logWeights, "logWeights");
        if (values.size() != logWeights.length) {
            throw new IllegalArgumentException("values/logWeights size mismatch: " + values.size() + " vs " + logWeights.length);
        }
        this.values = List.copyOf(values);
        this.logWeights = new double[logWeights.length];
        for (int i = 0; i < logWeights.length; i++) this.logWeights[i] = Weights.sanitize(logWeights[i]);
    }

    public int size() {
        return values.size();
    }

    public List<T> values() {
        return values;
    }

    public double[] logWeights() {
        return logWeights.clone();
    }

    /** @throws IllegalStateException when no draw landed in the target's support */
    public double[] normalizedWeights() {
        return Weights.normalize(logWeights);
    }

    public double effectiveSampleSize() {
        return Weights.effectiveSampleSize(normalizedWeights());
    }

    /** Self-normalized estimate of E_π[f(X)]. */
    public double estimate(ToDoubleFunction<T> f) {
        Objects.requireNonNull(f, "f");
        double[] w = normalizedWeights();
        double acc = 0.0;
        for (int i = 0; i < w.length; i++) {
            if (w[i] == 0.0) continue;
            acc += w[i] * f.applyAsDouble(values.get(i));
        }
        return acc;
    }

    /**
     * log of the average unnormalized weight, an estimate of the log normalizing constant of π
     * relative to q.
     */
    public double logEvidence() {
        double lse = Weights.logSumExp(logWeights);
        return (lse == Double.NEGATIVE_INFINITY) ? lse : lse - Math.log(size());
    }
}

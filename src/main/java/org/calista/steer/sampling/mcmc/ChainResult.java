package org.calista.steer.sampling.mcmc;

import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Retained draws of one Markov chain plus its diagnostics.
 */
public final class ChainResult<T> {

    /** Autocorrelation lags considered by {@link #effectiveSampleSize(ToDoubleFunction)}. */
    public static final int MAX_LAG = 50;

    private final List<T> samples;
    private final long proposals;
    private final long accepted;

    public ChainResult(List<T> samples, long proposals, long accepted) {
        this.samples = List.copyOf(Objects.requireNonNull(samples, "samples"));
        if (proposals < 0 || accepted < 0 || accepted > proposals) {
            throw new IllegalArgumentException("invalid counters proposals=" + proposals + " accepted=" + accepted);
        }
        this.proposals = proposals;
        this.accepted = accepted;
    }

    public List<T> samples() {
        return samples;
    }

    public int size() {
        return samples.size();
    }

    public long proposals() {
        return proposals;
    }

    public long accepted() {
        return accepted;
    }

    /** accepted / proposed over every transition, burn-in included. */
    public double acceptanceRate() {
        return (proposals == 0) ? 0.0 : (double) accepted / proposals;
    }

    public double mean(ToDoubleFunction<T> statistic) {
        if (samples.isEmpty()) return Double.NaN;
        double acc = 0.0;
        for (T s : samples) acc += statistic.applyAsDouble(s);
        return acc / samples.size();
    }

    /**
     * ESS = n / (1 + 2 Σ ρ_k), summing lag autocorrelations from k = 1 while they stay positive,
     * up to {@link #MAX_LAG} or n/2.
     */
    public double effectiveSampleSize(ToDoubleFunction<T> statistic) {
        int n = samples.size();
        if (n < 2) return n;

        double[] x = new double[n];
        double mean = 0.0;
        for (int i = 0; i < n; i++) {
            x[i] = statistic.applyAsDouble(samples.get(i));
            mean += x[i];
        }
        mean /= n;

        double var = 0.0;
        for (double v : x) var += (v - mean) * (v - mean);
        if (var == 0.0) return n;

        int maxLag = Math.min(MAX_LAG, n / 2);
        double rhoSum = 0.0;
        for (int k = 1; k <= maxLag; k++) {
            double c = 0.0;
            for (int i = 0; i + k < n; i++) c += (x[i] - mean) * (x[i + k] - mean);
            double rho = c / var;
            if (rho <= 0.0) break;
            rhoSum += rho;
        }
        return n / (1.0 + 2.0 * rhoSum);
    }
}

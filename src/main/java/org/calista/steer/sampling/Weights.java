package org.calista.steer.sampling;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Weights: log-space weight arithmetic shared by every sampler.
 *
 * <p>All normalizations subtract the maximum log-weight before exponentiating, so weights of
 * magnitude -1e4 normalize just as well as weights near zero.</p>
 */
public final class Weights {

    private static final Logger log = LogManager.getLogger(Weights.class);

    /** Tolerance used by callers that check Σw = 1. */
    public static final double EPSILON = 1e-9;

    private Weights() {}

    /** NaN is clipped to -∞; everything else passes through. */
    public static double sanitize(double logWeight) {
        if (Double.isNaN(logWeight)) {
            log.warn("weight.nan clipped to -inf");
            return Double.NEGATIVE_INFINITY;
        }
        // +∞ would dominate every normalization; treat it as the largest finite value.
        if (logWeight == Double.POSITIVE_INFINITY) {
            log.warn("weight.posinf clipped to max finite");
            return Double.MAX_VALUE;
        }
        return logWeight;
    }

    public static double max(double[] logWeights) {
        Objects.requireNonNull(logWeights, "logWeights");
        double max = Double.NEGATIVE_INFINITY;
        for (double w : logWeights) {
            if (w > max) max = w;
        }
        return max;
    }

    /** True when no entry carries probability mass. */
    public static boolean collapsed(double[] logWeights) {
        return max(logWeights) == Double.NEGATIVE_INFINITY;
    }

    /**
     * log(Σ exp(w_i)). Returns -∞ for an empty or fully collapsed array.
     */
    public static double logSumExp(double[] logWeights) {
        double max = max(logWeights);
        if (max == Double.NEGATIVE_INFINITY) return Double.NEGATIVE_INFINITY;

        double sum = 0.0;
        for (double w : logWeights) {
            if (w == Double.NEGATIVE_INFINITY) continue;
            sum += Math.exp(w - max);
        }
        return max + Math.log(sum);
    }

    /**
     * Normalized linear weights. The result sums to 1 within {@link #EPSILON}.
     *
     * @throws IllegalStateException if every log-weight is -∞
     */
    public static double[] normalize(double[] logWeights) {
        Objects.requireNonNull(logWeights, "logWeights");
        if (logWeights.length == 0) return new double[0];

        double max = max(logWeights);
        if (max == Double.NEGATIVE_INFINITY) {
            throw new IllegalStateException("Cannot normalize: all " + logWeights.length + " log-weights are -inf");
        }

        double[] out = new double[logWeights.length];
        double sum = 0.0;
        for (int i = 0; i < logWeights.length; i++) {
            double w = logWeights[i];
            out[i] = (w == Double.NEGATIVE_INFINITY) ? 0.0 : Math.exp(w - max);
            sum += out[i];
        }
        for (int i = 0; i < out.length; i++) out[i] /= sum;
        return out;
    }

    /** ESS = 1 / Σ w_i² over normalized weights. */
    public static double effectiveSampleSize(double[] normalizedWeights) {
        Objects.requireNonNull(normalizedWeights, "normalizedWeights");
        double sq = 0.0;
        for (double w : normalizedWeights) sq += w * w;
        return (sq > 0.0) ? 1.0 / sq : 0.0;
    }

    /** First index of the largest value; -1 for an empty array. */
    public static int argmax(double[] values) {
        Objects.requireNonNull(values, "values");
        int best = -1;
        double bestVal = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < values.length; i++) {
            if (best < 0 || values[i] > bestVal) {
                best = i;
                bestVal = values[i];
            }
        }
        return best;
    }

    /** Cumulative sums; the last entry is forced to exactly 1. */
    public static double[] cumulative(double[] normalizedWeights) {
        double[] cum = new double[normalizedWeights.length];
        double acc = 0.0;
        for (int i = 0; i < normalizedWeights.length; i++) {
            acc += normalizedWeights[i];
            cum[i] = acc;
        }
        // trailing zero-weight entries must stay unreachable
        int last = cum.length - 1;
        while (last > 0 && normalizedWeights[last] == 0.0) last--;
        if (last >= 0) {
            for (int i = last; i < cum.length; i++) cum[i] = 1.0;
        }
        return cum;
    }

    /**
     * First index j with {@code u < cum[j]}. Zero-weight entries never satisfy the strict
     * comparison against a preceding equal value, so they are never chosen.
     */
    public static int search(double[] cum, double u) {
        int lo = 0;
        int hi = cum.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (u < cum[mid]) hi = mid;
            else lo = mid + 1;
        }
        return lo;
    }
}

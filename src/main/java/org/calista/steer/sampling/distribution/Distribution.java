package org.calista.steer.sampling.distribution;

import org.calista.steer.sampling.LogDensity;

import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * A samplable probability distribution.
 *
 * <h3>Contract</h3>
 * <ul>
 *     <li>{@link #logPdf(Object)} is finite inside the support and -∞ outside it.</li>
 *     <li>{@link #sample(RandomGenerator)} consumes randomness only from the supplied generator.</li>
 *     <li>Implementations are immutable and safe to share across threads.</li>
 * </ul>
 */
public interface Distribution<T> extends LogDensity<T> {

    T sample(RandomGenerator rng);

    double logPdf(T x);

    default double pdf(T x) {
        double lp = logPdf(x);
        return (lp == Double.NEGATIVE_INFINITY) ? 0.0 : Math.exp(lp);
    }

    @Override
    default double logDensity(T x) {
        return logPdf(x);
    }

    String name();

    /** Parameters for logs and diagnostics. */
    default Map<String, Object> parameters() {
        return Map.of();
    }
}

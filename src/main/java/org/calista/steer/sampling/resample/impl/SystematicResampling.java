package org.calista.steer.sampling.resample.impl;

import org.calista.steer.sampling.Weights;
import org.calista.steer.sampling.resample.ResamplingStrategy;

import java.util.random.RandomGenerator;

/**
 * One uniform offset u0 in [0, 1/N), points u_i = u0 + i/N. Lowest variance of the shipped
 * schemes; the default.
 */
public final class SystematicResampling implements ResamplingStrategy {

    @Override
    public int[] resample(double[] normalizedWeights, RandomGenerator rng) {
        int n = normalizedWeights.length;
        double[] cum = Weights.cumulative(normalizedWeights);
        int[] out = new int[n];

        double u0 = rng.nextDouble() / n;
        int j = 0;
        for (int i = 0; i < n; i++) {
            double u = u0 + (double) i / n;
            // points are increasing, so the scan never moves backwards
            while (j < n - 1 && !(u < cum[j])) j++;
            out[i] = j;
        }
        return out;
    }

    @Override
    public String name() {
        return "systematic";
    }
}

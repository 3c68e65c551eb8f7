package org.calista.steer.sampling.resample.impl;

import org.calista.steer.sampling.Weights;
import org.calista.steer.sampling.resample.ResamplingStrategy;

import java.util.random.RandomGenerator;

/** One independent uniform per stratum [i/N, (i+1)/N). */
public final class StratifiedResampling implements ResamplingStrategy {

    @Override
    public int[] resample(double[] normalizedWeights, RandomGenerator rng) {
        int n = normalizedWeights.length;
        double[] cum = Weights.cumulative(normalizedWeights);
        int[] out = new int[n];

        int j = 0;
        for (int i = 0; i < n; i++) {
            double u = (i + rng.nextDouble()) / n;
            while (j < n - 1 && !(u < cum[j])) j++;
            out[i] = j;
        }
        return out;
    }

    @Override
    public String name() {
        return "stratified";
    }
}

package org.calista.steer.sampling.resample.impl;

import org.calista.steer.sampling.Weights;
import org.calista.steer.sampling.resample.ResamplingStrategy;

import java.util.random.RandomGenerator;

/** N independent draws from the categorical distribution of the weights. */
public final class MultinomialResampling implements ResamplingStrategy {

    @Override
    public int[] resample(double[] normalizedWeights, RandomGenerator rng) {
        int n = normalizedWeights.length;
        double[] cum = Weights.cumulative(normalizedWeights);
        int[] out = new int[n];
        for (int i = 0; i < n; i++) {
            out[i] = Weights.search(cum, rng.nextDouble());
        }
        return out;
    }

    @Override
    public String name() {
        return "multinomial";
    }
}

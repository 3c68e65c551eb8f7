package org.calista.steer.sampling.resample.impl;

import org.calista.steer.sampling.Weights;
import org.calista.steer.sampling.resample.ResamplingStrategy;

import java.util.random.RandomGenerator;

/**
 * floor(N·w_i) deterministic copies of each particle, the remaining slots drawn multinomially
 * from the residual weights.
 */
public final class ResidualResampling implements ResamplingStrategy {

    @Override
    public int[] resample(double[] normalizedWeights, RandomGenerator rng) {
        int n = normalizedWeights.length;
        int[] out = new int[n];
        double[] residual = new double[n];

        int k = 0;
        for (int i = 0; i < n; i++) {
            double scaled = n * normalizedWeights[i];
            int copies = (int) Math.floor(scaled);
            for (int c = 0; c < copies && k < n; c++) out[k++] = i;
            residual[i] = scaled - copies;
        }
        if (k == n) return out;

        double total = 0.0;
        for (double r : residual) total += r;
        if (!(total > 0.0)) {
            // rounding left slots but no residual mass; reuse the heaviest particle
            int best = Weights.argmax(normalizedWeights);
            while (k < n) out[k++] = best;
            return out;
        }
        for (int i = 0; i < n; i++) residual[i] /= total;

        double[] cum = Weights.cumulative(residual);
        while (k < n) out[k++] = Weights.search(cum, rng.nextDouble());
        return out;
    }

    @Override
    public String name() {
        return "residual";
    }
}

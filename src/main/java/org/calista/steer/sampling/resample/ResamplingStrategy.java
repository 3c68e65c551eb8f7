package org.calista.steer.sampling.resample;

import java.util.random.RandomGenerator;

/**
 * Draws N ancestor indices from N normalized weights.
 *
 * <h3>Contract</h3>
 * <ul>
 *     <li>Input weights are non-negative and sum to 1; the caller never passes a collapsed population.</li>
 *     <li>Output has exactly N entries, each in [0, N).</li>
 *     <li>A zero-weight index is never returned.</li>
 *     <li>Deterministic for a given generator state.</li>
 * </ul>
 */
public interface ResamplingStrategy {

    int[] resample(double[] normalizedWeights, RandomGenerator rng);

    String name();
}

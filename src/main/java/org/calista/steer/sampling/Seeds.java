package org.calista.steer.sampling;

import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

/**
 * Deterministic seed mixing.
 *
 * <p>Every random draw in a run comes from a stream derived from (seed, step, index), so results
 * do not depend on which worker thread ran which particle.</p>
 */
public final class Seeds {

    private static final long STEP_SALT = 0xA0761D6478BD642FL;
    private static final long INDEX_SALT = 0xE7037ED1A0B428DBL;
    private static final long GLOBAL_SALT = 0x8EBC6AF09C88C6E3L;

    private Seeds() {}

    /** SplitMix64 finalizer over x+y. */
    public static long mix(long x, long y) {
        long z = x + 0x9E3779B97F4A7C15L + y;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    /** Stream for one particle at one step. */
    public static RandomGenerator stream(long seed, int step, int index) {
        long s = mix(mix(seed, STEP_SALT * (step + 1L)), INDEX_SALT * (index + 1L));
        return new SplittableRandom(s);
    }

    /** Stream for decisions that are global to a step (resampling, output selection). */
    public static RandomGenerator global(long seed, int step) {
        return new SplittableRandom(mix(seed ^ GLOBAL_SALT, step));
    }

    /** Independent streams for n parallel chains or particles. */
    public static RandomGenerator[] parallelStreams(long seed, int n) {
        SplittableRandom root = new SplittableRandom(seed);
        RandomGenerator[] out = new RandomGenerator[n];
        for (int i = 0; i < n; i++) out[i] = root.split();
        return out;
    }
}

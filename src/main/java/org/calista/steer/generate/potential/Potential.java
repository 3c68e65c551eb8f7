package org.calista.steer.generate.potential;

import org.calista.steer.generate.SequenceState;

/**
 * Potential: a non-negative score that steers the particle population.
 *
 * <p>The engine adds {@code log(score)} to a particle's log-weight, so a score of 0 kills the
 * particle and a score of 1 leaves it untouched. {@link #score(SequenceState)} is called from
 * worker threads concurrently and must be pure.</p>
 *
 * <p>{@link PotentialScope#INCREMENTAL} potentials look at {@link SequenceState#appended()} only;
 * {@link PotentialScope#COMPLETE} potentials see the finished sequence once.</p>
 */
public interface Potential {

    String name();

    PotentialScope scope();

    /** Score in [0,1]. Values ≤ 0 mean "impossible". */
    double score(SequenceState state);

    /** Cheap pre-check; false short-circuits to a zero score without calling {@link #score}. */
    default boolean isSatisfied(SequenceState state) {
        return true;
    }

    /** When true a thrown exception aborts the run instead of zeroing the particle. */
    default boolean fatalOnError() {
        return false;
    }
}

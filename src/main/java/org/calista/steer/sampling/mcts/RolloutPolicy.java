package org.calista.steer.sampling.mcts;

import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Chooses actions during the simulation phase. {@code available} is never empty.
 */
@FunctionalInterface
public interface RolloutPolicy<S, A> {

    A select(S state, List<A> available, RandomGenerator rng);
}

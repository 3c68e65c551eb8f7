package org.calista.steer.sampling.mcts.impl;

import org.calista.steer.sampling.mcts.RolloutPolicy;

import java.util.List;
import java.util.random.RandomGenerator;

/** Uniformly random action. */
public final class RandomRolloutPolicy<S, A> implements RolloutPolicy<S, A> {

    @Override
    public A select(S state, List<A> available, RandomGenerator rng) {
        return available.get(rng.nextInt(available.size()));
    }
}

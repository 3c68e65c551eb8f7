package org.calista.steer.sampling.mcts.impl;

import org.calista.steer.sampling.mcts.RolloutPolicy;

import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleBiFunction;
import java.util.random.RandomGenerator;

/** Random action with probability epsilon, greedy otherwise. */
public final class EpsilonGreedyRolloutPolicy<S, A> implements RolloutPolicy<S, A> {

    private final ToDoubleBiFunction<S, A> valueFunction;
    private final double epsilon;

    public EpsilonGreedyRolloutPolicy(ToDoubleBiFunction<S, A> valueFunction, double epsilon) {
        this.valueFunction = Objects.requireNonNull(valueFunction, "valueFunction");
        if (!(epsilon >= 0.0 && epsilon <= 1.0)) throw new IllegalArgumentException("epsilon must be in [0,1]: " + epsilon);
        this.epsilon = epsilon;
    }

    @Override
    public A select(S state, List<A> available, RandomGenerator rng) {
        if (rng.nextDouble() < epsilon) return available.get(rng.nextInt(available.size()));
        return GreedyRolloutPolicy.argmax(state, available, valueFunction);
    }
}

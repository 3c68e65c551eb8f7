package org.calista.steer.sampling.mcts.impl;

import org.calista.steer.sampling.mcts.RolloutPolicy;

import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleBiFunction;
import java.util.random.RandomGenerator;

/** Always the action with the highest estimated value; first wins ties. */
public final class GreedyRolloutPolicy<S, A> implements RolloutPolicy<S, A> {

    private final ToDoubleBiFunction<S, A> valueFunction;

    public GreedyRolloutPolicy(ToDoubleBiFunction<S, A> valueFunction) {
        this.valueFunction = Objects.requireNonNull(valueFunction, "valueFunction");
    }

    @Override
    public A select(S state, List<A> available, RandomGenerator rng) {
        return argmax(state, available, valueFunction);
    }

    static <S, A> A argmax(S state, List<A> available, ToDoubleBiFunction<S, A> f) {
        A best = null;
        double bestVal = Double.NEGATIVE_INFINITY;
        for (A a : available) {
            double v = f.applyAsDouble(state, a);
            if (best == null || v > bestVal) {
                best = a;
                bestVal = v;
            }
        }
        return best;
    }
}

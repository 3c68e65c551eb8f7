package org.calista.steer.sampling.mcts.impl;

import org.calista.steer.sampling.Weights;
import org.calista.steer.sampling.mcts.RolloutPolicy;

import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleBiFunction;
import java.util.random.RandomGenerator;

/**
 * Samples actions proportionally to a non-negative heuristic. Falls back to uniform when every
 * heuristic value is zero.
 */
public final class HeuristicRolloutPolicy<S, A> implements RolloutPolicy<S, A> {

    private final ToDoubleBiFunction<S, A> heuristic;

    public HeuristicRolloutPolicy(ToDoubleBiFunction<S, A> heuristic) {
        this.heuristic = Objects.requireNonNull(heuristic, "heuristic");
    }

    @Override
    public A select(S state, List<A> available, RandomGenerator rng) {
        double[] w = new double[available.size()];
        double total = 0.0;
        for (int i = 0; i < w.length; i++) {
            double h = heuristic.applyAsDouble(state, available.get(i));
            w[i] = (h > 0.0 && Double.isFinite(h)) ? h : 0.0;
            total += w[i];
        }
        if (!(total > 0.0)) return available.get(rng.nextInt(available.size()));

        for (int i = 0; i < w.length; i++) w[i] /= total;
        return available.get(Weights.search(Weights.cumulative(w), rng.nextDouble()));
    }
}

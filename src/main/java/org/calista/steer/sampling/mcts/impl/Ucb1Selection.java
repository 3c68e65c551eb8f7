package org.calista.steer.sampling.mcts.impl;

import org.calista.steer.sampling.mcts.SearchNode;
import org.calista.steer.sampling.mcts.SelectionStrategy;

import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * UCB1: argmax value + c·sqrt(ln N / n). Iterates children in expansion order with a strict
 * comparison, so the first-expanded child wins ties.
 */
public final class Ucb1Selection<S, A> implements SelectionStrategy<S, A> {

    public static final double DEFAULT_EXPLORATION = Math.sqrt(2.0);

    private final double explorationWeight;

    public Ucb1Selection() {
        this(DEFAULT_EXPLORATION);
    }

    public Ucb1Selection(double explorationWeight) {
        if (!(explorationWeight >= 0.0)) throw new IllegalArgumentException("explorationWeight must be >= 0: " + explorationWeight);
        this.explorationWeight = explorationWeight;
    }

    @Override
    public A select(SearchNode<S, A> node, List<A> available) {
        HashSet<A> allowed = new HashSet<>(available);
        A best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Map.Entry<A, SearchNode<S, A>> e : node.children().entrySet()) {
            if (!allowed.contains(e.getKey())) continue;
            double s = e.getValue().ucb(explorationWeight);
            if (best == null || s > bestScore) {
                best = e.getKey();
                bestScore = s;
            }
        }
        if (best == null) throw new IllegalStateException("No expanded child among " + available.size() + " available actions");
        return best;
    }

    public double explorationWeight() {
        return explorationWeight;
    }
}

package org.calista.steer.sampling.mcts;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SearchNode: one state in the search tree.
 *
 * <p>Children are kept in insertion (expansion) order; that order is the tie-break everywhere.
 * {@code value} is the running mean of the rewards backpropagated through this node.</p>
 */
public final class SearchNode<S, A> {

    private final S state;
    private final A action;
    private final SearchNode<S, A> parent;
    private final int depth;
    private final LinkedHashMap<A, SearchNode<S, A>> children = new LinkedHashMap<>();

    private long visits;
    private double value;

    SearchNode(S state, A action, SearchNode<S, A> parent) {
        this.state = Objects.requireNonNull(state, "state");
        this.action = action;
        this.parent = parent;
        this.depth = (parent == null) ? 0 : parent.depth + 1;
    }

    public static <S, A> SearchNode<S, A> root(S state) {
        return new SearchNode<>(state, null, null);
    }

    public S state() { return state; }

    /** Action that led here; null at the root. */
    public A action() { return action; }

    public SearchNode<S, A> parent() { return parent; }

    public int depth() { return depth; }

    public long visits() { return visits; }

    public double value() { return value; }

    public Map<A, SearchNode<S, A>> children() {
        return Collections.unmodifiableMap(children);
    }

    public SearchNode<S, A> child(A a) {
        return children.get(a);
    }

    public boolean isFullyExpanded(List<A> available) {
        for (A a : available) {
            if (!children.containsKey(a)) return false;
        }
        return true;
    }

    SearchNode<S, A> addChild(A a, S childState) {
        SearchNode<S, A> c = new SearchNode<>(childState, a, this);
        children.put(a, c);
        return c;
    }

    void update(double reward) {
        visits++;
        value += (reward - value) / visits;
    }

    void restoreStats(long v, double mean) {
        this.visits = v;
        this.value = mean;
    }

    /**
     * UCB1 score as seen from the parent: value + c·sqrt(ln N_parent / n). Unvisited nodes score +∞.
     */
    public double ucb(double explorationWeight) {
        if (visits == 0) return Double.POSITIVE_INFINITY;
        long parentVisits = (parent == null) ? visits : parent.visits;
        return value + explorationWeight * Math.sqrt(Math.log(Math.max(1, parentVisits)) / visits);
    }

    /** Child with the highest mean value; the earliest-expanded child wins ties. Null when leaf. */
    public SearchNode<S, A> bestChild() {
        return bestOf(children.values());
    }

    static <S, A> SearchNode<S, A> bestOf(Collection<SearchNode<S, A>> nodes) {
        SearchNode<S, A> best = null;
        for (SearchNode<S, A> c : nodes) {
            if (best == null || c.value > best.value) best = c;
        }
        return best;
    }

    @Override
    public String toString() {
        return "SearchNode{action=" + action + ", depth=" + depth + ", visits=" + visits + ", value=" + value + "}";
    }
}

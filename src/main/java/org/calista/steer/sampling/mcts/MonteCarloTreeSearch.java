package org.calista.steer.sampling.mcts;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.steer.sampling.mcts.impl.RandomRolloutPolicy;
import org.calista.steer.sampling.mcts.impl.Ucb1Selection;

import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * MonteCarloTreeSearch: selection, expansion, simulation, backpropagation.
 *
 * <p>Each iteration descends with the selection strategy through fully expanded nodes, expands
 * the first untried action (in problem order), runs a rollout and backpropagates its reward
 * to the root. {@code maxDepth} bounds the search horizon: nodes at that depth are not expanded
 * and rollouts stop when they reach it.</p>
 *
 * <p>Not thread-safe. The tree is kept between calls, so repeated {@link #search()} calls refine
 * the same statistics, and {@link #advanceRoot(Object)} reuses the subtree of the chosen action.</p>
 */
public final class MonteCarloTreeSearch<S, A> {

    private static final Logger log = LogManager.getLogger(MonteCarloTreeSearch.class);

    private final SearchProblem<S, A> problem;
    private final SelectionStrategy<S, A> selection;
    private final RolloutPolicy<S, A> rollout;
    private final int maxIterations;
    private final int maxDepth;
    private final SplittableRandom rng;

    private SearchNode<S, A> root;

    private MonteCarloTreeSearch(Builder<S, A> b) {
        this.problem = Objects.requireNonNull(b.problem, "problem");
        this.selection = (b.selection != null) ? b.selection : new Ucb1Selection<>(b.explorationWeight);
        this.rollout = (b.rollout != null) ? b.rollout : new RandomRolloutPolicy<>();
        if (b.maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1: " + b.maxIterations);
        if (b.maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1: " + b.maxDepth);
        this.maxIterations = b.maxIterations;
        this.maxDepth = b.maxDepth;
        this.rng = new SplittableRandom(b.seed);
        this.root = SearchNode.root(Objects.requireNonNull(b.initialState, "initialState"));
    }

    public static <S, A> Builder<S, A> builder(SearchProblem<S, A> problem, S initialState) {
        return new Builder<>(problem, initialState);
    }

    public static final class Builder<S, A> {
        private final SearchProblem<S, A> problem;
        private final S initialState;
        private SelectionStrategy<S, A> selection;
        private RolloutPolicy<S, A> rollout;
        private double explorationWeight = Ucb1Selection.DEFAULT_EXPLORATION;
        private int maxIterations = 1000;
        private int maxDepth = 10;
        private long seed = 42L;

        private Builder(SearchProblem<S, A> problem, S initialState) {
            this.problem = Objects.requireNonNull(problem, "problem");
            this.initialState = Objects.requireNonNull(initialState, "initialState");
        }

        public Builder<S, A> selection(SelectionStrategy<S, A> s) {
            this.selection = Objects.requireNonNull(s, "selection");
            return this;
        }

        public Builder<S, A> rollout(RolloutPolicy<S, A> p) {
            this.rollout = Objects.requireNonNull(p, "rollout");
            return this;
        }

        /** Only used when no explicit selection strategy is set. */
        public Builder<S, A> explorationWeight(double c) {
            this.explorationWeight = c;
            return this;
        }

        public Builder<S, A> maxIterations(int n) {
            this.maxIterations = n;
            return this;
        }

        public Builder<S, A> maxDepth(int d) {
            this.maxDepth = d;
            return this;
        }

        public Builder<S, A> seed(long seed) {
            this.seed = seed;
            return this;
        }

        public MonteCarloTreeSearch<S, A> build() {
            return new MonteCarloTreeSearch<>(this);
        }
    }

    // ---------------------------------------------------------------------
    // Search
    // ---------------------------------------------------------------------

    public A search() {
        return search(maxIterations);
    }

    /**
     * Runs {@code iterations} iterations and returns the root action with the highest mean reward.
     *
     * @throws IllegalStateException when the root has no actions
     */
    public A search(int iterations) {
        if (iterations < 1) throw new IllegalArgumentException("iterations must be >= 1: " + iterations);
        if (problem.isTerminal(root.state()) || problem.actions(root.state()).isEmpty()) {
            throw new IllegalStateException("Root state has no actions to search");
        }

        for (int i = 0; i < iterations; i++) {
            SearchNode<S, A> leaf = selectAndExpand(root);
            double reward = simulate(leaf);
            backpropagate(leaf, reward);
        }

        SearchNode<S, A> best = root.bestChild();
        if (log.isDebugEnabled()) {
            log.debug("mcts.done iterations={} rootVisits={} children={} best={} value={}",
                    iterations, root.visits(), root.children().size(), best.action(), best.value());
        }
        return best.action();
    }

    private SearchNode<S, A> selectAndExpand(SearchNode<S, A> start) {
        SearchNode<S, A> node = start;
        while (true) {
            if (problem.isTerminal(node.state()) || node.depth() >= maxDepth) return node;

            List<A> available = problem.actions(node.state());
            if (available.isEmpty()) return node;

            for (A a : available) {
                if (node.child(a) == null) {
                    return node.addChild(a, problem.next(node.state(), a));
                }
            }
            node = node.child(selection.select(node, available));
        }
    }

    private double simulate(SearchNode<S, A> leaf) {
        S s = leaf.state();
        int depth = leaf.depth();
        while (depth < maxDepth && !problem.isTerminal(s)) {
            List<A> available = problem.actions(s);
            if (available.isEmpty()) break;
            s = problem.next(s, rollout.select(s, available, rng));
            depth++;
        }
        return problem.reward(s);
    }

    private void backpropagate(SearchNode<S, A> leaf, double reward) {
        for (SearchNode<S, A> n = leaf; n != null; n = n.parent()) {
            n.update(reward);
        }
    }

    // ---------------------------------------------------------------------
    // Tree re-use
    // ---------------------------------------------------------------------

    /**
     * Makes the child for {@code action} the new root, keeping its statistics. When that action was
     * never expanded a fresh root is created from the resulting state.
     */
    public void advanceRoot(A action) {
        SearchNode<S, A> child = root.child(action);
        if (child != null) {
            root = rebase(child);
        } else {
            root = SearchNode.root(problem.next(root.state(), action));
        }
    }

    // depth is relative to the root, so a re-rooted subtree is rebuilt with fresh depths
    private SearchNode<S, A> rebase(SearchNode<S, A> oldRoot) {
        SearchNode<S, A> fresh = SearchNode.root(oldRoot.state());
        copyInto(oldRoot, fresh);
        return fresh;
    }

    private void copyInto(SearchNode<S, A> from, SearchNode<S, A> to) {
        to.restoreStats(from.visits(), from.value());
        from.children().forEach((a, c) -> copyInto(c, to.addChild(a, c.state())));
    }

    public SearchNode<S, A> root() {
        return root;
    }

    public int maxIterations() {
        return maxIterations;
    }

    public int maxDepth() {
        return maxDepth;
    }
}

package org.calista.steer.sampling.mcts;

import java.util.List;

/**
 * The environment a tree search explores. States should be immutable values.
 *
 * <p>{@link #actions(Object)} must return actions in a stable order: expansion and tie-breaking
 * follow that order.</p>
 */
public interface SearchProblem<S, A> {

    List<A> actions(S state);

    S next(S state, A action);

    boolean isTerminal(S state);

    /** Reward of a state reached at the end of a rollout. */
    double reward(S state);
}

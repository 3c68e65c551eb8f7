package org.calista.steer.sampling.mcts;

import java.util.List;

/**
 * Picks which child of a fully expanded node to descend into.
 */
@FunctionalInterface
public interface SelectionStrategy<S, A> {

    A select(SearchNode<S, A> node, List<A> available);
}

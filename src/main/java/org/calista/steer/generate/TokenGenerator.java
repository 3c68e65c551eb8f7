package org.calista.steer.generate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Pluggable proposal backend: the "what comes next" capability the engine steers.
 *
 * <h3>Concurrency contract</h3>
 * The engine calls {@link #propose(SequenceState, RandomGenerator)} from several worker threads at
 * once, each with its own state and its own random stream. Implementations must be safe for such
 * concurrent calls and must draw randomness only from the supplied generator, otherwise fixed-seed
 * runs are not reproducible.
 *
 * <h3>Batching</h3>
 * Backends with an efficient batched path (a GPU model, a remote endpoint) return true from
 * {@link #supportsBatch()} and override {@link #proposeBatch(List, List)}.
 */
public interface TokenGenerator {

    Continuation propose(SequenceState state, RandomGenerator rng);

    default boolean supportsBatch() {
        return false;
    }

    /** One continuation per state, same order. Default: sequential {@link #propose} calls. */
    default List<Continuation> proposeBatch(List<SequenceState> states, List<RandomGenerator> rngs) {
        Objects.requireNonNull(states, "states");
        Objects.requireNonNull(rngs, "rngs");
        if (states.size() != rngs.size()) {
            throw new IllegalArgumentException("states/rngs size mismatch: " + states.size() + " vs " + rngs.size());
        }
        ArrayList<Continuation> out = new ArrayList<>(states.size());
        for (int i = 0; i < states.size(); i++) out.add(propose(states.get(i), rngs.get(i)));
        return out;
    }

    /** Initial state for a query. */
    default SequenceState start(String query) {
        return SequenceState.start(query);
    }

    default String name() {
        return getClass().getSimpleName();
    }
}

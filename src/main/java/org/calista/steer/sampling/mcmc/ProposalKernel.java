package org.calista.steer.sampling.mcmc;

import java.util.random.RandomGenerator;

/**
 * Proposal distribution q(x' | x) for Metropolis-Hastings.
 *
 * <p>Kernels with internal adaptation state are not thread-safe; use one per chain.</p>
 */
public interface ProposalKernel<T> {

    T propose(T current, RandomGenerator rng);

    /** log q(to | from). */
    double logDensity(T to, T from);

    /** Symmetric kernels skip the Hastings correction. */
    default boolean symmetric() {
        return false;
    }

    /** Called after every transition while the chain is in burn-in. */
    default void adapt(boolean accepted) {
    }

    default String name() {
        return getClass().getSimpleName();
    }
}

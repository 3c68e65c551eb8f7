package org.calista.steer.sampling.filter;

import java.util.random.RandomGenerator;

/**
 * State transition x_t = f(x_{t-1}, dt) + noise.
 * Must not mutate the input state.
 */
@FunctionalInterface
public interface SystemModel<S> {

    S propagate(S state, double dt, RandomGenerator rng);
}

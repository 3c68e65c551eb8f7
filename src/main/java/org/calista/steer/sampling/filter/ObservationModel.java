package org.calista.steer.sampling.filter;

/**
 * log p(observation | state). -∞ means the state cannot explain the observation.
 */
@FunctionalInterface
public interface ObservationModel<S, O> {

    double logLikelihood(O observation, S state);
}

package org.calista.steer.generate.engine;

import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Advances every live particle by one step: propose, append, score. Returns one outcome per
 * request; the call is the step's only join point.
 */
public interface Propagator {

    String name();

    /**
     * @throws TimeoutException when the run's deadline passes before all outcomes are in;
     *                          outstanding work is cancelled first
     */
    List<StepOutcome> propagate(List<ProposalRequest> requests, StepContext ctx) throws TimeoutException, InterruptedException;
}

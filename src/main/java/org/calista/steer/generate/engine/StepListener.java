package org.calista.steer.generate.engine;

import org.calista.steer.generate.SequenceState;
import org.calista.steer.sampling.particle.ParticlePopulation;

/**
 * Observer of completed SMC steps. Called on the generating thread once per step, after the
 * population was weighted and normalized and before it is resampled.
 */
@FunctionalInterface
public interface StepListener {

    StepListener NONE = (step, population, resampled) -> { };

    /**
     * @param step       1-based step number
     * @param population normalized population of this step
     * @param resampled  whether the engine resamples it before the next step
     */
    void onStep(int step, ParticlePopulation<SequenceState> population, boolean resampled);
}

package org.calista.steer.sampling.filter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.steer.sampling.Seeds;
import org.calista.steer.sampling.distribution.Distribution;
import org.calista.steer.sampling.particle.Particle;
import org.calista.steer.sampling.particle.ParticlePopulation;
import org.calista.steer.sampling.resample.ResamplingScheme;
import org.calista.steer.sampling.resample.ResamplingStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.ToDoubleFunction;

/**
 * ParticleFilter: bootstrap filter over an arbitrary state space.
 *
 * <p>Cycle: {@link #predict(double)} moves every particle through the system model,
 * {@link #update(Object)} multiplies in the observation likelihood (in log space), normalizes and
 * resamples when the relative ESS drops below the threshold. Termination is driven by the caller.</p>
 *
 * <p>Not thread-safe; one filter per tracking problem.</p>
 */
public final class ParticleFilter<S, O> {

    private static final Logger log = LogManager.getLogger(ParticleFilter.class);

    private final SystemModel<S> systemModel;
    private final ObservationModel<S, O> observationModel;
    private final ResamplingStrategy resampling;
    private final int numParticles;
    private final double essThreshold;
    private final SplittableRandom rng;
    private final AtomicLong ids = new AtomicLong();

    private ParticlePopulation<S> population;
    private int steps;
    private int resampleCount;

    private ParticleFilter(Builder<S, O> b) {
        this.systemModel = Objects.requireNonNull(b.systemModel, "systemModel");
        this.observationModel = Objects.requireNonNull(b.observationModel, "observationModel");
        this.resampling = (b.resampling != null) ? b.resampling : ResamplingScheme.SYSTEMATIC.strategy();
        if (b.numParticles < 1) throw new IllegalArgumentException("numParticles must be >= 1: " + b.numParticles);
        if (!(b.essThreshold >= 0.0 && b.essThreshold <= 1.0)) {
            throw new IllegalArgumentException("essThreshold must be in [0,1]: " + b.essThreshold);
        }
        this.numParticles = b.numParticles;
        this.essThreshold = b.essThreshold;
        this.rng = new SplittableRandom(b.seed);
    }

    public static <S, O> Builder<S, O> builder(SystemModel<S> systemModel, ObservationModel<S, O> observationModel) {
        return new Builder<>(systemModel, observationModel);
    }

    public static final class Builder<S, O> {
        private final SystemModel<S> systemModel;
        private final ObservationModel<S, O> observationModel;
        private ResamplingStrategy resampling;
        private int numParticles = 1000;
        private double essThreshold = 0.5;
        private long seed = 42L;

        private Builder(SystemModel<S> systemModel, ObservationModel<S, O> observationModel) {
            this.systemModel = Objects.requireNonNull(systemModel, "systemModel");
            this.observationModel = Objects.requireNonNull(observationModel, "observationModel");
        }

        public Builder<S, O> resampling(ResamplingStrategy strategy) {
            this.resampling = Objects.requireNonNull(strategy, "resampling");
            return this;
        }

        public Builder<S, O> numParticles(int n) {
            this.numParticles = n;
            return this;
        }

        public Builder<S, O> essThreshold(double t) {
            this.essThreshold = t;
            return this;
        }

        public Builder<S, O> seed(long seed) {
            this.seed = seed;
            return this;
        }

        public ParticleFilter<S, O> build() {
            return new ParticleFilter<>(this);
        }
    }

    // ---------------------------------------------------------------------
    // Initialization
    // ---------------------------------------------------------------------

    /** Initial states are cycled when fewer than numParticles are given. */
    public void initialize(List<S> initialStates) {
        Objects.requireNonNull(initialStates, "initialStates");
        if (initialStates.isEmpty()) throw new IllegalArgumentException("initialStates must not be empty");

        ArrayList<Particle<S>> ps = new ArrayList<>(numParticles);
        for (int i = 0; i < numParticles; i++) {
            ps.add(Particle.root(ids.getAndIncrement(), initialStates.get(i % initialStates.size())));
        }
        population = ParticlePopulation.of(ps);
        steps = 0;
        resampleCount = 0;
    }

    public void initialize(Distribution<S> prior) {
        Objects.requireNonNull(prior, "prior");
        ArrayList<S> states = new ArrayList<>(numParticles);
        for (int i = 0; i < numParticles; i++) states.add(prior.sample(rng));
        initialize(states);
    }

    // ---------------------------------------------------------------------
    // Predict / Update
    // ---------------------------------------------------------------------

    public void predict(double dt) {
        requireInitialized();
        ArrayList<Particle<S>> next = new ArrayList<>(numParticles);
        for (Particle<S> p : population.particles()) {
            next.add(p.withState(systemModel.propagate(p.state(), dt, rng)));
        }
        population = population.replace(next);
    }

    /**
     * Incorporates one observation.
     *
     * @return true when the step resampled
     * @throws IllegalStateException when no particle can explain the observation
     */
    public boolean update(O observation) {
        requireInitialized();

        ArrayList<Particle<S>> next = new ArrayList<>(numParticles);
        for (Particle<S> p : population.particles()) {
            double ll = observationModel.logLikelihood(observation, p.state());
            next.add(p.reweighted(ll));
        }
        ParticlePopulation<S> weighted = population.replace(next);
        if (weighted.collapsed()) {
            throw new IllegalStateException("Particle filter collapsed at step " + (steps + 1)
                    + ": every particle has zero likelihood");
        }
        population = weighted.normalizedLogSpace();
        steps++;

        double rel = population.relativeEss();
        boolean resampled = false;
        if (numParticles > 1 && rel < essThreshold) {
            population = population.resample(resampling, Seeds.global(rng.nextLong(), steps), ids::getAndIncrement);
            resampleCount++;
            resampled = true;
        }
        if (log.isDebugEnabled()) {
            log.debug("filter.update step={} relEss={} resampled={}", steps, String.format("%.3f", rel), resampled);
        }
        return resampled;
    }

    /** predict then update. */
    public boolean step(O observation, double dt) {
        predict(dt);
        return update(observation);
    }

    // ---------------------------------------------------------------------
    // Estimates
    // ---------------------------------------------------------------------

    /** Weighted mean of a statistic of the state. */
    public double estimate(ToDoubleFunction<S> statistic) {
        requireInitialized();
        double[] w = population.normalizedWeights();
        double acc = 0.0;
        for (int i = 0; i < w.length; i++) {
            if (w[i] == 0.0) continue;
            acc += w[i] * statistic.applyAsDouble(population.get(i).state());
        }
        return acc;
    }

    public S mostLikely() {
        requireInitialized();
        return population.best().state();
    }

    public double effectiveSampleSize() {
        requireInitialized();
        return population.effectiveSampleSize();
    }

    public ParticlePopulation<S> population() {
        requireInitialized();
        return population;
    }

    public int steps() {
        return steps;
    }

    public int resampleCount() {
        return resampleCount;
    }

    public int numParticles() {
        return numParticles;
    }

    private void requireInitialized() {
        if (population == null) throw new IllegalStateException("ParticleFilter is not initialized");
    }
}

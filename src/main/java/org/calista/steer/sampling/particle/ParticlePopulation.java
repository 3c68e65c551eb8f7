package org.calista.steer.sampling.particle;

import org.calista.steer.sampling.Weights;
import org.calista.steer.sampling.resample.ResamplingStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.random.RandomGenerator;

/**
 * ParticlePopulation: an ordered, fixed-size set of particles.
 *
 * <p>Immutable. Order is significant: it is the tie-break for selection and for the cumulative
 * table used by resampling. NaN log-weights are clipped to -∞ when the population is built.</p>
 */
public final class ParticlePopulation<S> {

    private final List<Particle<S>> particles;
    private final double[] logWeights;
    /** null when collapsed. */
    private final double[] normalized;

    private ParticlePopulation(List<Particle<S>> particles) {
        ArrayList<Particle<S>> copy = new ArrayList<>(particles.size());
        double[] lw = new double[particles.size()];
        for (int i = 0; i < particles.size(); i++) {
            Particle<S> p = Objects.requireNonNull(particles.get(i), "particle");
            double w = Weights.sanitize(p.logWeight());
            if (w != p.logWeight()) p = p.withLogWeight(w);
            copy.add(p);
            lw[i] = w;
        }
        this.particles = List.copyOf(copy);
        this.logWeights = lw;
        this.normalized = Weights.collapsed(lw) ? null : Weights.normalize(lw);
    }

    public static <S> ParticlePopulation<S> of(List<Particle<S>> particles) {
        Objects.requireNonNull(particles, "particles");
        if (particles.isEmpty()) throw new IllegalArgumentException("population must not be empty");
        return new ParticlePopulation<>(particles);
    }

    /** N particles with ids 0..N-1, equal weights, all sharing the initial state. */
    public static <S> ParticlePopulation<S> uniform(S initial, int n) {
        if (n < 1) throw new IllegalArgumentException("n must be >= 1: " + n);
        ArrayList<Particle<S>> ps = new ArrayList<>(n);
        for (int i = 0; i < n; i++) ps.add(Particle.root(i, initial));
        return new ParticlePopulation<>(ps);
    }

    public int size() {
        return particles.size();
    }

    public Particle<S> get(int i) {
        return particles.get(i);
    }

    public List<Particle<S>> particles() {
        return particles;
    }

    public double[] logWeights() {
        return logWeights.clone();
    }

    public boolean collapsed() {
        return Weights.collapsed(logWeights);
    }

    public int aliveCount() {
        int n = 0;
        for (double w : logWeights) if (w != Double.NEGATIVE_INFINITY) n++;
        return n;
    }

    /**
     * Normalized linear weights, Σ = 1.
     *
     * @throws IllegalStateException when the population is collapsed
     */
    public double[] normalizedWeights() {
        if (normalized == null) {
            throw new IllegalStateException("Cannot normalize: all " + logWeights.length + " log-weights are -inf");
        }
        return normalized.clone();
    }

    public double effectiveSampleSize() {
        return Weights.effectiveSampleSize(normalizedWeights());
    }

    public double relativeEss() {
        return effectiveSampleSize() / size();
    }

    /**
     * Copy whose log-weights are shifted so that Σ exp(logW) = 1. Relative weights are unchanged.
     */
    public ParticlePopulation<S> normalizedLogSpace() {
        double lse = Weights.logSumExp(logWeights);
        if (lse == Double.NEGATIVE_INFINITY) {
            throw new IllegalStateException("Cannot normalize a collapsed population of " + size());
        }
        ArrayList<Particle<S>> out = new ArrayList<>(size());
        for (Particle<S> p : particles) out.add(p.withLogWeight(p.logWeight() - lse));
        return new ParticlePopulation<>(out);
    }

    /**
     * Resamples N offspring. Offspring carry log-weight 0, so afterwards every normalized
     * weight is exactly 1/N.
     */
    public ParticlePopulation<S> resample(ResamplingStrategy strategy, RandomGenerator rng, LongSupplier ids) {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(rng, "rng");
        Objects.requireNonNull(ids, "ids");

        int[] idx = strategy.resample(normalizedWeights(), rng);
        if (idx.length != size()) {
            throw new IllegalStateException(strategy.name() + " returned " + idx.length + " indices for " + size() + " particles");
        }
        ArrayList<Particle<S>> out = new ArrayList<>(idx.length);
        for (int j : idx) out.add(particles.get(j).offspring(ids.getAsLong()));
        return new ParticlePopulation<>(out);
    }

    /** Highest-weight particle; the first one wins ties. */
    public Particle<S> best() {
        return particles.get(Weights.argmax(logWeights));
    }

    public ParticlePopulation<S> replace(List<Particle<S>> next) {
        Objects.requireNonNull(next, "next");
        if (next.size() != size()) {
            throw new IllegalArgumentException("population size must stay " + size() + ", got " + next.size());
        }
        return new ParticlePopulation<>(next);
    }

    @Override
    public String toString() {
        return "ParticlePopulation{n=" + size() + ", alive=" + aliveCount() + "}";
    }
}

package org.calista.steer.sampling.filter.impl;

import org.calista.steer.sampling.filter.SystemModel;

import java.util.random.RandomGenerator;

/** Scalar x' = x + drift·dt + N(0, σ²·dt). */
public final class RandomWalkModel implements SystemModel<Double> {

    private final double drift;
    private final double noiseStd;

    public RandomWalkModel(double drift, double noiseStd) {
        if (!(noiseStd >= 0.0)) throw new IllegalArgumentException("noiseStd must be >= 0: " + noiseStd);
        this.drift = drift;
        this.noiseStd = noiseStd;
    }

    @Override
    public Double propagate(Double state, double dt, RandomGenerator rng) {
        double x = state + drift * dt;
        if (noiseStd > 0.0) x += noiseStd * Math.sqrt(Math.max(0.0, dt)) * rng.nextGaussian();
        return x;
    }
}

package org.calista.steer.sampling.filter.impl;

import org.calista.steer.sampling.filter.SystemModel;

import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Vector x' = (I + dt·A)·x + N(0, diag(σ²)·dt).
 *
 * <p>A constant-velocity model over (position, velocity) is {@code A = [[0,1],[0,0]]}.</p>
 */
public final class LinearGaussianSystemModel implements SystemModel<double[]> {

    private final double[][] a;
    private final double[] noiseStd;

    public LinearGaussianSystemModel(double[][] transition, double[] noiseStd) {
        Objects.requireNonNull(transition, "transition");
        Objects.requireNonNull(noiseStd, "noiseStd");
        int d = transition.length;
        if (d == 0) throw new IllegalArgumentException("transition must not be empty");
        for (double[] row : transition) {
            if (row.length != d) throw new IllegalArgumentException("transition must be square");
        }
        if (noiseStd.length != d) throw new IllegalArgumentException("noiseStd must have " + d + " entries");
        this.a = new double[d][];
        for (int i = 0; i < d; i++) this.a[i] = transition[i].clone();
        this.noiseStd = noiseStd.clone();
    }

    public static LinearGaussianSystemModel constantVelocity(double positionNoise, double velocityNoise) {
        return new LinearGaussianSystemModel(
                new double[][]{{0.0, 1.0}, {0.0, 0.0}},
                new double[]{positionNoise, velocityNoise});
    }

    public int dimension() {
        return a.length;
    }

    @Override
    public double[] propagate(double[] state, double dt, RandomGenerator rng) {
        int d = a.length;
        if (state.length != d) throw new IllegalArgumentException("state must have " + d + " entries, got " + state.length);

        double sqrtDt = Math.sqrt(Math.max(0.0, dt));
        double[] out = new double[d];
        for (int i = 0; i < d; i++) {
            double acc = state[i];
            for (int j = 0; j < d; j++) acc += dt * a[i][j] * state[j];
            if (noiseStd[i] > 0.0) acc += noiseStd[i] * sqrtDt * rng.nextGaussian();
            out[i] = acc;
        }
        return out;
    }
}

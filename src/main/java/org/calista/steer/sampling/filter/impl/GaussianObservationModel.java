package org.calista.steer.sampling.filter.impl;

import org.calista.steer.sampling.filter.ObservationModel;

import java.util.Objects;

/**
 * y = H·x + N(0, diag(σ²)). Log-likelihood of a vector observation under independent
 * Gaussian noise per component.
 */
public final class GaussianObservationModel implements ObservationModel<double[], double[]> {

    private static final double LOG_SQRT_2PI = 0.5 * Math.log(2.0 * Math.PI);

    private final double[][] h;
    private final double[] noiseStd;

    public GaussianObservationModel(double[][] observationMatrix, double[] noiseStd) {
        Objects.requireNonNull(observationMatrix, "observationMatrix");
        Objects.requireNonNull(noiseStd, "noiseStd");
        if (observationMatrix.length == 0) throw new IllegalArgumentException("observationMatrix must not be empty");
        if (noiseStd.length != observationMatrix.length) {
            throw new IllegalArgumentException("noiseStd must have " + observationMatrix.length + " entries");
        }
        for (double s : noiseStd) {
            if (!(s > 0.0)) throw new IllegalArgumentException("noiseStd must be > 0: " + s);
        }
        this.h = new double[observationMatrix.length][];
        for (int i = 0; i < h.length; i++) this.h[i] = observationMatrix[i].clone();
        this.noiseStd = noiseStd.clone();
    }

    /** Observes the first coordinate of a d-dimensional state. */
    public static GaussianObservationModel firstCoordinate(int stateDim, double noiseStd) {
        double[][] h = new double[1][stateDim];
        h[0][0] = 1.0;
        return new GaussianObservationModel(h, new double[]{noiseStd});
    }

    @Override
    public double logLikelihood(double[] observation, double[] state) {
        if (observation.length != h.length) {
            throw new IllegalArgumentException("observation must have " + h.length + " entries, got " + observation.length);
        }
        double ll = 0.0;
        for (int i = 0; i < h.length; i++) {
            double predicted = 0.0;
            for (int j = 0; j < state.length && j < h[i].length; j++) predicted += h[i][j] * state[j];
            double z = (observation[i] - predicted) / noiseStd[i];
            ll += -0.5 * z * z - Math.log(noiseStd[i]) - LOG_SQRT_2PI;
        }
        return ll;
    }
}

package org.calista.steer.sampling.resample;

import org.calista.steer.sampling.resample.impl.MultinomialResampling;
import org.calista.steer.sampling.resample.impl.ResidualResampling;
import org.calista.steer.sampling.resample.impl.StratifiedResampling;
import org.calista.steer.sampling.resample.impl.SystematicResampling;

import java.util.Locale;

public enum ResamplingScheme {
    MULTINOMIAL,
    SYSTEMATIC,
    STRATIFIED,
    RESIDUAL;

    public ResamplingStrategy strategy() {
        return switch (this) {
            case MULTINOMIAL -> new MultinomialResampling();
            case SYSTEMATIC -> new SystematicResampling();
            case STRATIFIED -> new StratifiedResampling();
            case RESIDUAL -> new ResidualResampling();
        };
    }

    /** Case-insensitive; null or blank gives the default, SYSTEMATIC. */
    public static ResamplingScheme parse(String s) {
        if (s == null || s.isBlank()) return SYSTEMATIC;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown resampling scheme: " + s, e);
        }
    }
}

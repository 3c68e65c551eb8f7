package org.calista.steer.generate;

import java.util.Locale;

/** How the final sequence is chosen from the last population. */
public enum OutputSelection {
    /** Highest weight; the first particle wins ties. */
    MAX_WEIGHT,
    /** One draw from the normalized weights. */
    WEIGHTED_SAMPLE;

    public static OutputSelection parse(String s) {
        if (s == null || s.isBlank()) return MAX_WEIGHT;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown output selection: " + s, e);
        }
    }
}

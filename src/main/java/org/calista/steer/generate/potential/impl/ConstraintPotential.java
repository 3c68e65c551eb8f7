package org.calista.steer.generate.potential.impl;

import org.calista.steer.generate.SequenceState;
import org.calista.steer.generate.potential.AbstractPotential;
import org.calista.steer.generate.potential.PotentialScope;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Several soft constraints over the text; the weakest one decides the score.
 *
 * <p>The factory constraints never go below {@link #SOFT_FLOOR}: they push particles away from
 * violations without killing them.</p>
 */
public final class ConstraintPotential extends AbstractPotential {

    public static final double SOFT_FLOOR = 0.1;

    private final List<ToDoubleFunction<String>> constraints;

    public ConstraintPotential(String name, PotentialScope scope, List<ToDoubleFunction<String>> constraints) {
        super(name, scope, false);
        this.constraints = List.copyOf(Objects.requireNonNull(constraints, "constraints"));
    }

    @SafeVarargs
    public static ConstraintPotential of(String name, ToDoubleFunction<String>... constraints) {
        return new ConstraintPotential(name, PotentialScope.COMPLETE, List.of(constraints));
    }

    @Override
    public double score(SequenceState state) {
        if (constraints.isEmpty()) return 1.0;
        String text = subject(state);
        double min = 1.0;
        for (ToDoubleFunction<String> c : constraints) min = Math.min(min, c.applyAsDouble(text));
        return min;
    }

    /** Character length within [min, max]; outside, the ratio to the nearest bound. */
    public static ToDoubleFunction<String> lengthConstraint(int minLength, int maxLength) {
        if (minLength < 0 || maxLength < minLength) {
            throw new IllegalArgumentException("bad length bounds: [" + minLength + "," + maxLength + "]");
        }
        return text -> {
            int len = text.length();
            if (len >= minLength && len <= maxLength) return 1.0;
            if (len < minLength) return Math.max(SOFT_FLOOR, (double) len / minLength);
            return Math.max(SOFT_FLOOR, (double) maxLength / len);
        };
    }

    /** At least {@code threshold} of the elements appear (case-insensitive). */
    public static ToDoubleFunction<String> requiredElements(List<String> elements, int threshold) {
        List<String> lowered = lower(elements);
        if (threshold < 1) throw new IllegalArgumentException("threshold must be >= 1: " + threshold);
        return text -> {
            String t = text.toLowerCase(Locale.ROOT);
            int count = 0;
            for (String e : lowered) if (t.contains(e)) count++;
            if (count >= threshold) return 1.0;
            if (count == 0) return SOFT_FLOOR;
            return SOFT_FLOOR + (1.0 - SOFT_FLOOR) * ((double) count / threshold);
        };
    }

    /** None of the words appear (case-insensitive). */
    public static ToDoubleFunction<String> forbiddenContent(List<String> forbidden) {
        List<String> lowered = lower(forbidden);
        return text -> {
            String t = text.toLowerCase(Locale.ROOT);
            for (String f : lowered) if (t.contains(f)) return SOFT_FLOOR;
            return 1.0;
        };
    }

    private static List<String> lower(List<String> in) {
        Objects.requireNonNull(in, "elements");
        return in.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
    }
}

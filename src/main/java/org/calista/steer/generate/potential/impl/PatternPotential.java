package org.calista.steer.generate.potential.impl;

import org.calista.steer.generate.SequenceState;
import org.calista.steer.generate.potential.AbstractPotential;
import org.calista.steer.generate.potential.PotentialScope;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Regex rule over the judged text. A satisfied rule scores 1, a violated one scores {@code penalty}
 * (0 makes the rule hard).
 */
public final class PatternPotential extends AbstractPotential {

    private final Pattern pattern;
    private final boolean mustMatch;
    private final double penalty;

    public PatternPotential(String name, PotentialScope scope, Pattern pattern, boolean mustMatch, double penalty) {
        super(name, scope, false);
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        if (!(penalty >= 0.0 && penalty <= 1.0)) throw new IllegalArgumentException("penalty must be in [0,1]: " + penalty);
        this.mustMatch = mustMatch;
        this.penalty = penalty;
    }

    /** The finished text must contain a match. */
    public static PatternPotential require(String regex, double penalty) {
        return new PatternPotential("require:" + regex, PotentialScope.COMPLETE, Pattern.compile(regex), true, penalty);
    }

    /** No step may append text matching the pattern. */
    public static PatternPotential forbid(String regex, double penalty) {
        return new PatternPotential("forbid:" + regex, PotentialScope.INCREMENTAL, Pattern.compile(regex), false, penalty);
    }

    @Override
    public double score(SequenceState state) {
        boolean found = pattern.matcher(subject(state)).find();
        return found == mustMatch ? 1.0 : penalty;
    }

    public Pattern pattern() {
        return pattern;
    }
}

package org.calista.steer.generate.potential.impl;

import org.calista.steer.generate.SequenceState;
import org.calista.steer.generate.potential.AbstractPotential;
import org.calista.steer.generate.potential.PotentialScope;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Hard ban on individual tokens. Only the tokens appended in the current step are checked.
 */
public final class ForbiddenTokenPotential extends AbstractPotential {

    private final Set<String> forbidden;
    private final boolean ignoreCase;

    public ForbiddenTokenPotential(Set<String> forbidden, boolean ignoreCase) {
        super("forbidden_tokens", PotentialScope.INCREMENTAL, false);
        this.ignoreCase = ignoreCase;
        this.forbidden = ignoreCase
                ? forbidden.stream().map(t -> t.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet())
                : Set.copyOf(forbidden);
    }

    @Override
    public boolean isSatisfied(SequenceState state) {
        for (String t : state.appended()) {
            if (forbidden.contains(ignoreCase ? t.toLowerCase(Locale.ROOT) : t)) return false;
        }
        return true;
    }

    @Override
    public double score(SequenceState state) {
        return 1.0;
    }
}

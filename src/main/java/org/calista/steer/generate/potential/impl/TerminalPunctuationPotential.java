package org.calista.steer.generate.potential.impl;

import org.calista.steer.generate.SequenceState;
import org.calista.steer.generate.StopCondition;
import org.calista.steer.generate.potential.AbstractPotential;
import org.calista.steer.generate.potential.PotentialScope;

/**
 * Finished sequences must end in '.', '!' or '?'.
 */
public final class TerminalPunctuationPotential extends AbstractPotential {

    private final double otherwise;

    public TerminalPunctuationPotential() {
        this(0.0);
    }

    /** @param otherwise score for sequences that do not end in punctuation; 0 makes it hard */
    public TerminalPunctuationPotential(double otherwise) {
        super("terminal_punctuation", PotentialScope.COMPLETE, false);
        if (!(otherwise >= 0.0 && otherwise <= 1.0)) throw new IllegalArgumentException("otherwise must be in [0,1]: " + otherwise);
        this.otherwise = otherwise;
    }

    @Override
    public double score(SequenceState state) {
        return StopCondition.endsWithTerminalPunctuation(state.text()) ? 1.0 : otherwise;
    }
}

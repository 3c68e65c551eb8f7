package org.calista.steer.generate;

/**
 * A potential marked fatal-on-error threw while scoring.
 */
public class PotentialFailureException extends GenerationException {

    private final String potential;

    public PotentialFailureException(String potential, Throwable cause) {
        super("Potential '" + potential + "' failed: " + cause.getMessage(), cause);
        this.potential = potential;
    }

    public String potential() {
        return potential;
    }
}

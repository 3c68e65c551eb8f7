package org.calista.steer.generate;

/**
 * Every particle reached log-weight −∞: no sequence satisfies the potentials.
 */
public class ConstraintUnsatisfiableException extends GenerationException {

    private final int step;

    public ConstraintUnsatisfiableException(int step) {
        super("All particles collapsed to zero weight at step " + step);
        this.step = step;
    }

    public int step() {
        return step;
    }
}

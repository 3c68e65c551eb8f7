package org.calista.steer.generate.potential;

/** When a potential is applied during a run. */
public enum PotentialScope {
    /** Every step, on the tokens appended in that step. */
    INCREMENTAL,
    /** Once per particle, when its sequence is finished. */
    COMPLETE
}

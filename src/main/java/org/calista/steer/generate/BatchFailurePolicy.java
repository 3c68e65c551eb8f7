package org.calista.steer.generate;

import java.util.Locale;

/** What a batched run does when the batched generator call fails. */
public enum BatchFailurePolicy {
    /** Redo the step per particle and stay in task-parallel mode for the rest of the run. */
    FALLBACK_TO_TASK_PARALLEL,
    /** Abort the run with a {@link GenerationFailedException}. */
    FAIL;

    public static BatchFailurePolicy parse(String s) {
        if (s == null || s.isBlank()) return FALLBACK_TO_TASK_PARALLEL;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown batch failure policy: " + s, e);
        }
    }
}

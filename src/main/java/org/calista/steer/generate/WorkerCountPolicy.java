package org.calista.steer.generate;

import java.util.Locale;

/**
 * Default worker count when the task does not set one explicitly.
 */
public enum WorkerCountPolicy {
    /** 2 × GPU devices when GPU use is on and devices are present, otherwise cores − 1. */
    PREFER_GPU_DEVICES,
    /** cores − 1 regardless of GPU settings. */
    PREFER_CPU_CORES;

    public static WorkerCountPolicy parse(String s) {
        if (s == null || s.isBlank()) return PREFER_GPU_DEVICES;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown worker count policy: " + s, e);
        }
    }
}

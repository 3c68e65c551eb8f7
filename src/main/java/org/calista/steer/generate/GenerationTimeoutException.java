package org.calista.steer.generate;

import java.time.Duration;

/**
 * The time budget expired before the first step completed, so there is no partial result.
 */
public class GenerationTimeoutException extends GenerationException {

    private final Duration timeout;

    public GenerationTimeoutException(Duration timeout) {
        super("Generation budget of " + timeout.toMillis() + "ms expired before the first step completed");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}

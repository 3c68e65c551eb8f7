package org.calista.steer.generate;

/** Unrecoverable failure not covered by a more specific type. */
public class GenerationFailedException extends GenerationException {

    public GenerationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}

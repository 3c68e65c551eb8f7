package org.calista.steer.generate;

/**
 * Root of the unchecked failures a generation run can end with.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.genbatch.orchestrator.generation;

/**
 * Thrown when the generation service returns an error or is unreachable.
 *
 * Transport failures keep the underlying {@link java.io.IOException} as the
 * cause; callers classify on the concrete subtype and the cause chain.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}

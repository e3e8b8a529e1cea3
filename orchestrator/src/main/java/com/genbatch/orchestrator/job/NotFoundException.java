package com.genbatch.orchestrator.job;

/**
 * A required asset or workflow does not exist.
 *
 * Fatal when raised while planning (no characters at all); terminal for a
 * single job when its workflow cannot be resolved on the worker.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}

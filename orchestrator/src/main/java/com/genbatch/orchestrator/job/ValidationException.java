package com.genbatch.orchestrator.job;

/**
 * Bad batch input (unknown scene, duplicate job identity, empty plan).
 * Fatal to the whole batch at plan time.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.genbatch.orchestrator.execution;

/** The fetched artifact could not be written to the output directory. */
public class ArtifactWriteException extends RuntimeException {

    public ArtifactWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}

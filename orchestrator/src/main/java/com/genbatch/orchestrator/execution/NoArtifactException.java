package com.genbatch.orchestrator.execution;

/** The request completed but listed no output file. */
public class NoArtifactException extends RuntimeException {

    public NoArtifactException(String message) {
        super(message);
    }
}

package com.genbatch.orchestrator.generation;

/** The service accepted the request but reported an execution error. */
public class GenerationFailedException extends GenerationException {

    public GenerationFailedException(String message) {
        super(message);
    }
}

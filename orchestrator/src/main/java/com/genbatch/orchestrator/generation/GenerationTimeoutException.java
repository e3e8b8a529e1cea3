package com.genbatch.orchestrator.generation;

/** No completion was observed before the deadline. */
public class GenerationTimeoutException extends GenerationException {

    public GenerationTimeoutException(String message) {
        super(message);
    }
}

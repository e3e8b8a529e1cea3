package com.genbatch.orchestrator.generation;

/** Non-2xx answer from the generation service. */
public class GenerationHttpException extends GenerationException {

    private final int statusCode;

    public GenerationHttpException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() { return statusCode; }
}

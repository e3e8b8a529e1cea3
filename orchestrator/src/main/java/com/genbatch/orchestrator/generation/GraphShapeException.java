package com.genbatch.orchestrator.generation;

/**
 * The workflow graph cannot be used as submitted: not in API format, or the
 * input image node is missing or ambiguous. Retrying never helps.
 */
public class GraphShapeException extends GenerationException {

    public GraphShapeException(String message) {
        super(message);
    }
}

package com.genbatch.orchestrator.worker;

/** The generation service could not be brought back to a healthy state. */
public class WorkerUnrecoverableException extends WorkerException {

    public WorkerUnrecoverableException(String message) {
        super(message);
    }

    public WorkerUnrecoverableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.genbatch.orchestrator.worker;

/** The control-plane API rejected a call or could not be reached. */
public class ControlPlaneException extends WorkerException {

    public ControlPlaneException(String message) {
        super(message);
    }

    public ControlPlaneException(String message, Throwable cause) {
        super(message, cause);
    }
}

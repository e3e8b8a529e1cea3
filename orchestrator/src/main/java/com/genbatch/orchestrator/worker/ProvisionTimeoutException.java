package com.genbatch.orchestrator.worker;

/** The worker did not become reachable within the provisioning window. */
public class ProvisionTimeoutException extends WorkerException {

    public ProvisionTimeoutException(String message) {
        super(message);
    }
}

package com.genbatch.orchestrator.worker;

import java.util.Optional;

/**
 * Remote API that creates, inspects and disposes of workers.
 */
public interface ControlPlane {

    /** @return the new worker's id */
    String create(WorkerSpec spec);

    /** Current state; empty while the control plane does not know the id yet. */
    Optional<WorkerStatus> status(String workerId);

    void resume(String workerId);

    /** Pause; the worker can be resumed later. */
    void stop(String workerId);

    /** Delete permanently. */
    void terminate(String workerId);

    /** Base URL of the worker's generation service. */
    String serviceUrl(String workerId);
}

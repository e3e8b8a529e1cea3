package com.genbatch.orchestrator.generation;

import java.util.Optional;

/**
 * One way of waiting for a request to finish.
 */
public interface CompletionBackend {

    String name();

    /**
     * Wait until the check reports completion or the backend cannot continue.
     *
     * @return the completion record, or empty if the deadline passed or this
     *         backend gave up (the caller then falls back or times out)
     * @throws GenerationFailedException when the service reports an execution error
     */
    Optional<HistoryEntry> await(WaitRequest request, CompletionCheck check);
}

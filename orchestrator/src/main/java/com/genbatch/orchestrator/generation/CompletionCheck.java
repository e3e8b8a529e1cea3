package com.genbatch.orchestrator.generation;

import java.util.Optional;

/**
 * Point-in-time, idempotent completion query shared by every wait backend.
 *
 * Returns the completion record once the request is done, empty while it is
 * still queued or running, and throws {@link GenerationFailedException} when
 * the service reports an error.
 */
@FunctionalInterface
public interface CompletionCheck {

    Optional<HistoryEntry> check();

    /** The standard check against the history endpoint. */
    static CompletionCheck history(GenerationClient client, String requestId) {
        return () -> {
            Optional<HistoryEntry> entry = client.history(requestId);
            if (entry.isEmpty()) return Optional.empty();
            HistoryEntry h = entry.get();
            if (h.isCompleted() || h.hasOutputs()) return entry;
            if (h.isError()) {
                throw new GenerationFailedException(
                        "Generation failed for " + requestId + ": " + h.statusDetail());
            }
            return Optional.empty();
        };
    }
}

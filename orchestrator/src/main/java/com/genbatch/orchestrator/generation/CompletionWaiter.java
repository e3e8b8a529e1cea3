package com.genbatch.orchestrator.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Waits for one submitted request using an ordered list of backends.
 *
 * Each backend gets the remaining time; when it gives up the next one takes
 * over with the same deadline and the same completion check, so a switch in
 * the middle of a wait neither misses nor double-counts a completion.
 */
public class CompletionWaiter {

    private static final Logger log = LoggerFactory.getLogger(CompletionWaiter.class);

    private final List<CompletionBackend> backends;
    private final Clock                   clock;

    public CompletionWaiter(List<CompletionBackend> backends, Clock clock) {
        if (backends.isEmpty()) throw new IllegalArgumentException("at least one backend required");
        this.backends = List.copyOf(backends);
        this.clock    = clock;
    }

    /**
     * @throws GenerationFailedException  if the service reports an execution error
     * @throws GenerationTimeoutException if nothing completes within {@code timeout}
     */
    public HistoryEntry await(String label, String requestId, String correlationId, Duration timeout,
                              CompletionCheck check) {
        Instant deadline = clock.instant().plus(timeout);
        WaitRequest request = new WaitRequest(label, requestId, correlationId, deadline);

        for (CompletionBackend backend : backends) {
            if (!clock.instant().isBefore(deadline)) break;
            log.debug("[{}] Waiting for {} via {}", label, requestId, backend.name());
            Optional<HistoryEntry> done = backend.await(request, check);
            if (done.isPresent()) return done.get();
        }
        throw new GenerationTimeoutException(
                "Generation of " + requestId + " timed out after " + timeout.getSeconds() + "s");
    }
}

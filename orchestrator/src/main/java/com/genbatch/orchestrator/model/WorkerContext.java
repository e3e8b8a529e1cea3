package com.genbatch.orchestrator.model;

import java.util.Collection;
import java.util.Set;

/**
 * Identity of one worker loop, passed explicitly to everything that runs
 * inside it and used as the prefix of every log line it produces.
 *
 * @param index       zero-based partition index
 * @param label       log prefix, e.g. {@code worker-2}
 * @param planned     identities of every job in this run's plan (for ETA lines)
 * @param parallelism number of concurrent worker loops
 */
public record WorkerContext(int index, String label, Set<String> planned, int parallelism) {

    public WorkerContext {
        planned = Set.copyOf(planned);
    }

    public static WorkerContext of(int index, Collection<String> planned, int parallelism) {
        return new WorkerContext(index, "worker-" + (index + 1), Set.copyOf(planned), parallelism);
    }
}

package com.genbatch.orchestrator.execution;

import java.nio.file.Path;

/**
 * Result of one attempt at a job.
 *
 *   Success   → artifact written, stop
 *   Transient → may succeed on another attempt (worker hiccup, timeout, 502...)
 *   Terminal  → will fail again until the input or configuration changes
 */
public sealed interface Outcome permits Outcome.Success, Outcome.Transient, Outcome.Terminal {

    record Success(Path artifact) implements Outcome {}

    record Transient(String reason, Throwable cause) implements Outcome {}

    record Terminal(String reason, Throwable cause) implements Outcome {}

    static Outcome success(Path artifact) {
        return new Success(artifact);
    }

    static Outcome retryable(String reason, Throwable cause) {
        return new Transient(reason, cause);
    }

    static Outcome terminal(String reason, Throwable cause) {
        return new Terminal(reason, cause);
    }
}

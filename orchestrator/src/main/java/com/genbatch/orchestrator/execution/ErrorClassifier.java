package com.genbatch.orchestrator.execution;

import com.genbatch.orchestrator.generation.GenerationFailedException;
import com.genbatch.orchestrator.generation.GenerationHttpException;
import com.genbatch.orchestrator.generation.GenerationTimeoutException;
import com.genbatch.orchestrator.generation.GraphShapeException;
import com.genbatch.orchestrator.job.NotFoundException;
import com.genbatch.orchestrator.worker.RemoteShellException;

import java.io.IOException;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Maps an exception raised by an attempt to a {@link Outcome}.
 *
 * Transient: I/O and shell failures, generation timeouts and execution
 * errors, retryable HTTP statuses. Terminal: graph shape, missing workflow,
 * other HTTP statuses, no artifact, local write failures. Anything else is
 * transient only if the worker no longer answers its health probe.
 */
public class ErrorClassifier {

    private final Set<Integer> retryableStatusCodes;

    public ErrorClassifier(Set<Integer> retryableStatusCodes) {
        this.retryableStatusCodes = Set.copyOf(retryableStatusCodes);
    }

    public Outcome classify(Exception e, BooleanSupplier workerHealthy) {
        String reason = describe(e);

        if (e instanceof GraphShapeException
                || e instanceof NotFoundException
                || e instanceof NoArtifactException
                || e instanceof ArtifactWriteException) {
            return Outcome.terminal(reason, e);
        }
        if (e instanceof GenerationHttpException http) {
            return retryableStatusCodes.contains(http.getStatusCode())
                    ? Outcome.retryable(reason, e)
                    : Outcome.terminal(reason, e);
        }
        if (e instanceof GenerationTimeoutException
                || e instanceof GenerationFailedException
                || e instanceof RemoteShellException
                || hasIoCause(e)) {
            return Outcome.retryable(reason, e);
        }
        return workerHealthy.getAsBoolean()
                ? Outcome.terminal(reason, e)
                : Outcome.retryable(reason + " (worker unhealthy)", e);
    }

    private static boolean hasIoCause(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof IOException) return true;
        }
        return false;
    }

    static String describe(Throwable e) {
        String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) root = root.getCause();
        if (root != e && root.getMessage() != null && !msg.contains(root.getMessage())) {
            msg = msg + ": " + root.getMessage();
        }
        return msg;
    }
}

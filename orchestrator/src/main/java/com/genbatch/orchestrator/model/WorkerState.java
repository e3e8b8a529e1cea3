package com.genbatch.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a remote worker.
 *
 * Transitions (happy path):
 *   CREATING → READY → HEALTHY → STOPPED | TERMINATED
 *
 * HEALTHY and UNHEALTHY alternate while the generation service dies and is
 * restarted. Every non-final state may move to STOPPED or TERMINATED during
 * teardown.
 */
public enum WorkerState {
    CREATING,
    READY,
    HEALTHY,
    UNHEALTHY,
    STOPPED,
    TERMINATED;

    public boolean isFinal() {
        return this == STOPPED || this == TERMINATED;
    }

    public boolean canTransitionTo(WorkerState next) {
        return allowedNext().contains(next);
    }

    private Set<WorkerState> allowedNext() {
        return switch (this) {
            case CREATING   -> EnumSet.of(READY, STOPPED, TERMINATED);
            case READY      -> EnumSet.of(HEALTHY, UNHEALTHY, STOPPED, TERMINATED);
            case HEALTHY    -> EnumSet.of(UNHEALTHY, STOPPED, TERMINATED);
            case UNHEALTHY  -> EnumSet.of(HEALTHY, STOPPED, TERMINATED);
            case STOPPED, TERMINATED -> EnumSet.noneOf(WorkerState.class);
        };
    }
}

package com.genbatch.orchestrator.worker;

/** What happens to a worker once its partition is done. */
public enum TeardownPolicy {
    /** Delete the worker. */
    TERMINATE,
    /** Pause it; it can be resumed by id later. */
    STOP,
    /** Do nothing. */
    LEAVE_RUNNING;

    /**
     * Created workers are terminated, attached ones are left as found.
     * {@code keep} turns either into a stop; {@code leaveRunning} wins over both.
     */
    public static TeardownPolicy resolve(boolean created, boolean keep, boolean leaveRunning) {
        if (leaveRunning) return LEAVE_RUNNING;
        if (keep) return STOP;
        return created ? TERMINATE : LEAVE_RUNNING;
    }
}

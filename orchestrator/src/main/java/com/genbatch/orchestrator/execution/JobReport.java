package com.genbatch.orchestrator.execution;

import com.genbatch.orchestrator.model.Job;

import java.nio.file.Path;
import java.time.Duration;

/**
 * What happened to one job in this run.
 *
 * @param artifact written or pre-existing file; null when failed or skipped by the ledger
 * @param attempts generation attempts made (0 when skipped)
 */
public record JobReport(Job job, Status status, Path artifact, String error, Duration duration, int attempts) {

    public enum Status { COMPLETED, FAILED, SKIPPED }

    static JobReport completed(Job job, Path artifact, Duration duration, int attempts) {
        return new JobReport(job, Status.COMPLETED, artifact, null, duration, attempts);
    }

    static JobReport failed(Job job, String error, Duration duration, int attempts) {
        return new JobReport(job, Status.FAILED, null, error, duration, attempts);
    }

    public static JobReport skipped(Job job, Path existing) {
        return new JobReport(job, Status.SKIPPED, existing, null, Duration.ZERO, 0);
    }

    /** True when an artifact for this job exists after the run. */
    public boolean hasArtifact() {
        return artifact != null;
    }
}

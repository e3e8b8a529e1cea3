package com.genbatch.orchestrator.progress;

import java.time.Duration;
import java.util.Optional;

/**
 * Progress snapshot with an optional time estimate.
 *
 * {@code averageJob} and {@code remainingTime} are empty until at least one
 * job finished in this run.
 */
public record EtaEstimate(
        int done,
        int total,
        int remaining,
        int parallelism,
        Optional<Duration> averageJob,
        Optional<Duration> remainingTime) {

    public String describe() {
        StringBuilder sb = new StringBuilder()
                .append("Progress: ").append(done).append('/').append(total).append(" done");
        if (remainingTime.isPresent() && averageJob.isPresent()) {
            sb.append(" | Avg: ").append(Durations.format(averageJob.get())).append("/job")
              .append(" | ETA: ").append(Durations.format(remainingTime.get()))
              .append(" (").append(remaining).append(" remaining");
            if (parallelism > 1) sb.append(", ").append(parallelism).append(" workers");
            sb.append(')');
        } else {
            sb.append(" | ").append(remaining).append(" remaining");
        }
        return sb.toString();
    }
}

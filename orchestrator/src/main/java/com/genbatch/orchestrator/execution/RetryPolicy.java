package com.genbatch.orchestrator.execution;

import com.genbatch.orchestrator.config.BatchProperties;

import java.time.Duration;

/**
 * How often a transiently failing job is re-attempted and how long to wait
 * in between. {@code multiplier = 1.0} gives a fixed backoff.
 *
 * @param maxRetries attempts after the first one
 */
public record RetryPolicy(int maxRetries, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public RetryPolicy {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1.0");
    }

    public static RetryPolicy from(BatchProperties.Retry retry) {
        return new RetryPolicy(retry.getMaxRetries(), retry.getBackoff(),
                retry.getMultiplier(), retry.getMaxBackoff());
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /** Wait before retry number {@code retry} (1-based). */
    public Duration backoffFor(int retry) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, retry - 1));
        long capped = (long) Math.min(millis, maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }
}

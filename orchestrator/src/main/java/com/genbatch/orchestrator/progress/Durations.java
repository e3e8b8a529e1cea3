package com.genbatch.orchestrator.progress;

import java.time.Duration;

/** Human-readable durations for log lines: {@code 1h 02m 03s}, {@code 2m 05s}. */
public final class Durations {

    private Durations() {}

    public static String format(Duration duration) {
        long total = Math.max(0, duration.getSeconds());
        long h = total / 3600;
        long m = (total % 3600) / 60;
        long s = total % 60;
        if (h > 0) return String.format("%dh %02dm %02ds", h, m, s);
        return String.format("%dm %02ds", m, s);
    }
}

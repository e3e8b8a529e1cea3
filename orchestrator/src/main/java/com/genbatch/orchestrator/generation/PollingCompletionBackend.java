package com.genbatch.orchestrator.generation;

import com.genbatch.orchestrator.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/** Runs the completion check at a fixed interval until the deadline. */
public class PollingCompletionBackend implements CompletionBackend {

    private static final Logger log = LoggerFactory.getLogger(PollingCompletionBackend.class);

    private final Duration interval;
    private final Clock    clock;
    private final Sleeper  sleeper;

    public PollingCompletionBackend(Duration interval, Clock clock, Sleeper sleeper) {
        this.interval = interval;
        this.clock    = clock;
        this.sleeper  = sleeper;
    }

    @Override
    public String name() {
        return "polling";
    }

    @Override
    public Optional<HistoryEntry> await(WaitRequest request, CompletionCheck check) {
        Instant begin = clock.instant();
        while (clock.instant().isBefore(request.deadline())) {
            Optional<HistoryEntry> done = check.check();
            if (done.isPresent()) return done;

            Duration left = Duration.between(clock.instant(), request.deadline());
            if (left.isNegative() || left.isZero()) break;
            log.debug("[{}] Waiting for {} ({}s)", request.label(), request.requestId(),
                    Duration.between(begin, clock.instant()).getSeconds());
            try {
                sleeper.sleep(left.compareTo(interval) < 0 ? left : interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new GenerationException("Interrupted while waiting for " + request.requestId(), e);
            }
        }
        return Optional.empty();
    }
}

package com.genbatch.orchestrator;

import java.time.Duration;

/**
 * Blocking pause used by every polling loop. Injected so tests can advance a
 * fake clock instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return d -> Thread.sleep(d.toMillis());
    }
}

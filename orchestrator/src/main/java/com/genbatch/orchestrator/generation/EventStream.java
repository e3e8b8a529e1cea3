package com.genbatch.orchestrator.generation;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/** A push channel of JSON text events scoped to one correlation id. */
public interface EventStream extends AutoCloseable {

    /**
     * Next text message.
     *
     * @return empty if nothing arrived within {@code wait}
     * @throws IOException if the stream failed or was closed by the peer
     */
    Optional<String> next(Duration wait) throws IOException, InterruptedException;

    @Override
    void close();

    @FunctionalInterface
    interface Factory {
        /** @throws IOException if the stream cannot be established */
        EventStream open(String correlationId) throws IOException;
    }
}

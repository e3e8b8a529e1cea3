package com.genbatch.orchestrator.generation;

import java.time.Instant;

/**
 * What a completion backend waits for, and until when.
 *
 * @param label log prefix of the worker loop doing the wait
 */
public record WaitRequest(String label, String requestId, String correlationId, Instant deadline) {}

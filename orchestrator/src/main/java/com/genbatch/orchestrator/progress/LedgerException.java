package com.genbatch.orchestrator.progress;

/**
 * Thrown when progress.json cannot be written. The in-memory ledger has
 * already been rolled back when this reaches the caller.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}

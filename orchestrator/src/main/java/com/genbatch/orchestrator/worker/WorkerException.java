package com.genbatch.orchestrator.worker;

/**
 * Worker-level failure. Fatal to the partition that owns the worker; sibling
 * partitions keep running.
 */
public class WorkerException extends RuntimeException {

    public WorkerException(String message) {
        super(message);
    }

    public WorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}

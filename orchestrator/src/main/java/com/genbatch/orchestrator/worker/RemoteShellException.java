package com.genbatch.orchestrator.worker;

/**
 * A remote command or transfer could not run (connection refused, timeout,
 * non-zero transfer exit). Usually means the worker is unreachable right now.
 */
public class RemoteShellException extends RuntimeException {

    public RemoteShellException(String message) {
        super(message);
    }

    public RemoteShellException(String message, Throwable cause) {
        super(message, cause);
    }
}

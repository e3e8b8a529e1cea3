package com.genbatch.orchestrator.worker;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Command and file-transfer channel to a worker. Used for service start-up,
 * workflow lookup, and as fallback when the service's own upload or download
 * fails.
 *
 * All methods throw {@link RemoteShellException} when the channel itself
 * fails; a command that runs and exits non-zero is reported in its result.
 */
public interface RemoteShell {

    ShellResult exec(String command, Duration timeout);

    void upload(Path local, String remotePath);

    void download(String remotePath, Path local);

    /** Factory bound to a worker's SSH endpoint. */
    @FunctionalInterface
    interface Factory {
        RemoteShell connect(WorkerStatus.SshEndpoint endpoint);
    }
}

package com.genbatch.orchestrator.worker;

import com.genbatch.orchestrator.config.BatchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link RemoteShell} backed by the local {@code ssh} and {@code scp} binaries.
 *
 * Output is redirected to temp files rather than pipes so a chatty command
 * cannot block on a full pipe buffer while we wait for it.
 */
public class SshRemoteShell implements RemoteShell {

    private static final Logger log = LoggerFactory.getLogger(SshRemoteShell.class);

    private final WorkerStatus.SshEndpoint endpoint;
    private final BatchProperties.Ssh      settings;

    public SshRemoteShell(WorkerStatus.SshEndpoint endpoint, BatchProperties.Ssh settings) {
        this.endpoint = endpoint;
        this.settings = settings;
    }

    @Override
    public ShellResult exec(String command, Duration timeout) {
        List<String> cmd = new ArrayList<>(List.of("ssh"));
        cmd.addAll(commonOptions());
        cmd.addAll(List.of("-p", String.valueOf(endpoint.port()), target(), command));
        return run(cmd, timeout);
    }

    @Override
    public void upload(Path local, String remotePath) {
        List<String> cmd = new ArrayList<>(List.of("scp"));
        cmd.addAll(commonOptions());
        cmd.addAll(List.of("-P", String.valueOf(endpoint.port()),
                local.toString(), target() + ":" + remotePath));
        ShellResult result = run(cmd, settings.getUploadTimeout());
        if (!result.ok()) {
            throw new RemoteShellException("scp upload of " + local + " failed: " + result.stderr().trim());
        }
    }

    @Override
    public void download(String remotePath, Path local) {
        List<String> cmd = new ArrayList<>(List.of("scp"));
        cmd.addAll(commonOptions());
        cmd.addAll(List.of("-P", String.valueOf(endpoint.port()),
                target() + ":" + remotePath, local.toString()));
        ShellResult result = run(cmd, settings.getDownloadTimeout());
        if (!result.ok()) {
            throw new RemoteShellException("scp download of " + remotePath + " failed: " + result.stderr().trim());
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private List<String> commonOptions() {
        return List.of(
                "-i", expandHome(settings.getKeyPath()),
                "-o", "StrictHostKeyChecking=no",
                "-o", "UserKnownHostsFile=/dev/null",
                "-o", "LogLevel=ERROR",
                "-o", "BatchMode=yes");
    }

    private String target() {
        return settings.getUser() + "@" + endpoint.host();
    }

    private ShellResult run(List<String> cmd, Duration timeout) {
        Path out = null;
        Path err = null;
        try {
            out = Files.createTempFile("genbatch-ssh", ".out");
            err = Files.createTempFile("genbatch-ssh", ".err");
            Process process = new ProcessBuilder(cmd)
                    .redirectOutput(out.toFile())
                    .redirectError(err.toFile())
                    .start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new RemoteShellException(cmd.get(0) + " to " + endpoint
                        + " timed out after " + timeout.getSeconds() + "s");
            }
            return new ShellResult(process.exitValue(),
                    Files.readString(out, StandardCharsets.UTF_8),
                    Files.readString(err, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RemoteShellException(cmd.get(0) + " to " + endpoint + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteShellException(cmd.get(0) + " to " + endpoint + " interrupted", e);
        } finally {
            deleteQuietly(out);
            deleteQuietly(err);
        }
    }

    private static void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}: {}", p, e.getMessage());
        }
    }

    private static String expandHome(String path) {
        return path.startsWith("~/") ? System.getProperty("user.home") + path.substring(1) : path;
    }
}

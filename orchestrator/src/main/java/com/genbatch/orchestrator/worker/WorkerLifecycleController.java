package com.genbatch.orchestrator.worker;

import com.genbatch.orchestrator.Sleeper;
import com.genbatch.orchestrator.config.BatchProperties;
import com.genbatch.orchestrator.generation.GenerationClient;
import com.genbatch.orchestrator.generation.GenerationClientFactory;
import com.genbatch.orchestrator.model.WorkerContext;
import com.genbatch.orchestrator.model.WorkerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Drives one remote worker through its lifecycle.
 *
 * <pre>
 *   CREATING ──provision()──▶ READY ──startService()──▶ HEALTHY ⇄ UNHEALTHY
 *       │                       │                          │
 *       └───────────────────────┴────── teardown() ────────┴──▶ STOPPED | TERMINATED
 * </pre>
 *
 * One instance per partition; not shared between threads. {@link #teardown()}
 * must be called from a finally block and never throws.
 */
public class WorkerLifecycleController {

    private static final Logger log = LoggerFactory.getLogger(WorkerLifecycleController.class);

    private static final Duration PROBE_TIMEOUT   = Duration.ofSeconds(10);
    private static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration INSTALL_TIMEOUT = Duration.ofSeconds(180);

    private final WorkerContext            ctx;
    private final ControlPlane             controlPlane;
    private final RemoteShell.Factory      shells;
    private final GenerationClientFactory  clients;
    private final BatchProperties.Worker   settings;
    private final Clock                    clock;
    private final Sleeper                  sleeper;

    private WorkerState      state = WorkerState.CREATING;
    private String           workerId;
    private boolean          created;
    private RemoteShell      shell;
    private GenerationClient client;

    public WorkerLifecycleController(WorkerContext ctx, ControlPlane controlPlane,
                                     RemoteShell.Factory shells, GenerationClientFactory clients,
                                     BatchProperties.Worker settings, Clock clock, Sleeper sleeper) {
        this.ctx          = ctx;
        this.controlPlane = controlPlane;
        this.shells       = shells;
        this.clients      = clients;
        this.settings     = settings;
        this.clock        = clock;
        this.sleeper      = sleeper;
    }

    public WorkerState state()         { return state; }
    public String workerId()           { return workerId; }
    public WorkerContext context()     { return ctx; }

    public GenerationClient client() {
        if (client == null) throw new IllegalStateException(ctx.label() + " is not provisioned");
        return client;
    }

    public RemoteShell shell() {
        if (shell == null) throw new IllegalStateException(ctx.label() + " is not provisioned");
        return shell;
    }

    // ------------------------------------------------------------------
    // CREATING → READY
    // ------------------------------------------------------------------

    /**
     * Create (or attach to) the worker and wait until it runs and answers a
     * shell probe.
     *
     * @throws ProvisionTimeoutException if it is not reachable within the window
     */
    public void provision() {
        String existing = settings.getExistingId();
        if (existing != null && !existing.isBlank()) {
            workerId = existing;
            created  = false;
            log.info("[{}] Attaching to existing worker {}", ctx.label(), workerId);
            WorkerStatus status = controlPlane.status(workerId)
                    .orElseThrow(() -> new WorkerException("Worker " + existing + " not found"));
            if (!status.isRunning()) {
                log.info("[{}] Worker {} is {}, resuming", ctx.label(), workerId, status.desiredState());
                controlPlane.resume(workerId);
            }
        } else {
            workerId = controlPlane.create(new WorkerSpec(settings.getNamePrefix() + "-" + (ctx.index() + 1)));
            created  = true;
            log.info("[{}] Worker created: {}", ctx.label(), workerId);
        }

        WorkerStatus.SshEndpoint endpoint = waitForReachable();
        client = clients.create(controlPlane.serviceUrl(workerId));
        transition(WorkerState.READY);
        log.info("[{}] Worker {} ready, ssh {}, service {}", ctx.label(), workerId, endpoint, client.baseUrl());
    }

    private WorkerStatus.SshEndpoint waitForReachable() {
        Instant start    = clock.instant();
        Instant deadline = start.plus(settings.getProvisionTimeout());
        while (clock.instant().isBefore(deadline)) {
            Optional<WorkerStatus> status = pollStatus();
            if (status.isPresent() && status.get().isRunning()) {
                Optional<WorkerStatus.SshEndpoint> endpoint = status.get().sshEndpoint();
                if (endpoint.isPresent()) {
                    RemoteShell candidate = shells.connect(endpoint.get());
                    if (probe(candidate)) {
                        shell = candidate;
                        return endpoint.get();
                    }
                }
            }
            log.info("[{}]   Status: {}, runtime: {} ({}s)", ctx.label(),
                    status.map(WorkerStatus::desiredState).orElse("unknown"),
                    status.map(s -> s.runtime() != null ? "yes" : "no").orElse("no"),
                    Duration.between(start, clock.instant()).getSeconds());
            pause(settings.getProvisionPollInterval());
        }
        throw new ProvisionTimeoutException("Worker " + workerId + " not ready after "
                + settings.getProvisionTimeout().getSeconds() + "s");
    }

    private Optional<WorkerStatus> pollStatus() {
        try {
            return controlPlane.status(workerId);
        } catch (ControlPlaneException e) {
            // Freshly created workers are briefly unknown to the API.
            log.debug("[{}] Status of {} unavailable: {}", ctx.label(), workerId, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean probe(RemoteShell candidate) {
        try {
            ShellResult r = candidate.exec("echo ok", PROBE_TIMEOUT);
            return r.ok() && r.stdout().contains("ok");
        } catch (RemoteShellException e) {
            log.debug("[{}] Shell probe failed: {}", ctx.label(), e.getMessage());
            return false;
        }
    }

    // ------------------------------------------------------------------
    // READY → HEALTHY, UNHEALTHY → HEALTHY
    // ------------------------------------------------------------------

    /**
     * Start the generation service unless it already answers, then wait for it.
     *
     * @throws WorkerUnrecoverableException if it does not become healthy in time
     */
    public void startService() {
        if (client().isHealthy()) {
            log.info("[{}] Generation service already running", ctx.label());
            transition(WorkerState.HEALTHY);
            return;
        }
        launchService();
        waitForHealthy();
    }

    /**
     * Block until the service is healthy, restarting it if needed.
     *
     * @throws WorkerUnrecoverableException if the restart does not bring it back
     */
    public void ensureReady() {
        if (client().isHealthy()) {
            if (state != WorkerState.HEALTHY) transition(WorkerState.HEALTHY);
            return;
        }
        log.warn("[{}] Generation service not responding, restarting", ctx.label());
        if (state != WorkerState.UNHEALTHY) transition(WorkerState.UNHEALTHY);
        launchService();
        waitForHealthy();
    }

    private void launchService() {
        String serviceDir = settings.getServiceDir();
        try {
            ShellResult ps = shell().exec("ps aux | grep 'python.*main.py' | grep '" + serviceDir
                    + "' | grep -v grep || true", COMMAND_TIMEOUT);
            if (!ps.stdout().isBlank()) {
                log.info("[{}] Service process already running, waiting for it", ctx.label());
                return;
            }
            String script = settings.getStartupScript();
            ShellResult check = shell().exec("test -x " + script + " && echo yes || echo no", COMMAND_TIMEOUT);
            if (check.stdout().contains("yes")) {
                log.info("[{}] Running startup script: {}", ctx.label(), script);
                shell().exec("nohup bash " + script + " > " + settings.getStartupLog() + " 2>&1 &", PROBE_TIMEOUT);
                return;
            }
            log.info("[{}] Starting generation service directly", ctx.label());
            shell().exec("for p in $(ps aux | grep 'python.*main.py' | grep -v grep | awk '{print $2}'); "
                    + "do kill -9 $p 2>/dev/null; done", PROBE_TIMEOUT);
            shell().exec("cd " + serviceDir + " && for d in custom_nodes/*/; do "
                    + "[ -f \"${d}requirements.txt\" ] && pip3 install -q -r \"${d}requirements.txt\" 2>/dev/null; "
                    + "done; true", INSTALL_TIMEOUT);
            shell().exec("cd " + serviceDir + " && nohup python3 main.py --listen 0.0.0.0 --port "
                    + settings.getServicePort() + " --disable-auto-launch > "
                    + settings.getServiceLog() + " 2>&1 &", PROBE_TIMEOUT);
        } catch (RemoteShellException e) {
            throw new WorkerUnrecoverableException("Cannot start generation service on " + workerId, e);
        }
    }

    private void waitForHealthy() {
        log.info("[{}] Waiting for generation service...", ctx.label());
        Instant deadline = clock.instant().plus(settings.getStartupTimeout());
        while (clock.instant().isBefore(deadline)) {
            pause(settings.getStartupPollInterval());
            if (client().isHealthy()) {
                transition(WorkerState.HEALTHY);
                log.info("[{}] Generation service ready", ctx.label());
                return;
            }
        }
        throw new WorkerUnrecoverableException("Generation service on " + workerId
                + " not healthy after " + settings.getStartupTimeout().getSeconds() + "s");
    }

    // ------------------------------------------------------------------
    // Teardown
    // ------------------------------------------------------------------

    public TeardownPolicy teardownPolicy() {
        return TeardownPolicy.resolve(created, settings.isKeep(), settings.isLeaveRunning());
    }

    /** Stop or terminate according to policy. Failures are logged only. */
    public void teardown() {
        if (workerId == null || state.isFinal()) return;
        TeardownPolicy policy = teardownPolicy();
        if (policy == TeardownPolicy.LEAVE_RUNNING) {
            log.info("[{}] Leaving worker {} running", ctx.label(), workerId);
            return;
        }
        if (client != null) {
            try {
                client.clearQueue();
            } catch (Exception e) {
                log.warn("[{}] Could not clear queue on {}: {}", ctx.label(), workerId, e.getMessage());
            }
        }
        try {
            if (policy == TeardownPolicy.STOP) {
                controlPlane.stop(workerId);
                transition(WorkerState.STOPPED);
                log.info("[{}] Worker {} stopped (can resume later)", ctx.label(), workerId);
            } else {
                controlPlane.terminate(workerId);
                transition(WorkerState.TERMINATED);
                log.info("[{}] Worker {} terminated", ctx.label(), workerId);
            }
        } catch (Exception e) {
            log.warn("[{}] Worker cleanup failed for {}: {}", ctx.label(), workerId, e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private void transition(WorkerState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(ctx.label() + ": illegal transition " + state + " → " + next);
        }
        log.debug("[{}] {} → {}", ctx.label(), state, next);
        state = next;
    }

    private void pause(Duration d) {
        try {
            sleeper.sleep(d);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerUnrecoverableException(ctx.label() + " interrupted", e);
        }
    }
}

package com.genbatch.orchestrator.worker;

import com.genbatch.orchestrator.Sleeper;
import com.genbatch.orchestrator.config.BatchProperties;
import com.genbatch.orchestrator.generation.GenerationClientFactory;
import com.genbatch.orchestrator.model.WorkerContext;

import java.time.Clock;

/** One {@link WorkerLifecycleController} per partition. */
public class WorkerControllerFactory {

    private final ControlPlane            controlPlane;
    private final RemoteShell.Factory     shells;
    private final GenerationClientFactory clients;
    private final BatchProperties.Worker  settings;
    private final Clock                   clock;
    private final Sleeper                 sleeper;

    public WorkerControllerFactory(ControlPlane controlPlane, RemoteShell.Factory shells,
                                   GenerationClientFactory clients, BatchProperties.Worker settings,
                                   Clock clock, Sleeper sleeper) {
        this.controlPlane = controlPlane;
        this.shells       = shells;
        this.clients      = clients;
        this.settings     = settings;
        this.clock        = clock;
        this.sleeper      = sleeper;
    }

    public WorkerLifecycleController create(WorkerContext ctx) {
        return new WorkerLifecycleController(ctx, controlPlane, shells, clients, settings, clock, sleeper);
    }

    /** Attaching to an existing worker means there is only one. */
    public boolean isAttachMode() {
        return settings.getExistingId() != null && !settings.getExistingId().isBlank();
    }
}

package com.genbatch.orchestrator.worker;

/** What to create. Hardware and image come from the control plane's template. */
public record WorkerSpec(String name) {}

package com.genbatch.orchestrator.model;

/**
 * Catalog entry: which seed image a scene starts from and which workflow renders it.
 */
public record SceneDefinition(String name, String seedFile, String workflowFile) {}

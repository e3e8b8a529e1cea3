package com.genbatch.orchestrator.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One unit of generation work: a seed image pushed through a workflow for
 * one character and (usually) one scene.
 *
 * Jobs are built once when the batch is planned and never change afterwards.
 * The {@link #identity()} is the key the progress ledger uses, so it must be
 * unique within a batch.
 *
 * @param identity        {@code character/scene}, or {@code character/workflow-name} without a scene
 * @param character       character folder name
 * @param scene           scene name from the catalog, or null for ad-hoc jobs
 * @param workflowRef     workflow file name or absolute remote path
 * @param seed            local seed image
 * @param destinationDir  directory the artifact is written to
 * @param destinationName artifact base name; the extension comes from the produced file
 */
public record Job(
        String identity,
        String character,
        String scene,
        String workflowRef,
        Path   seed,
        Path   destinationDir,
        String destinationName) {

    public Job {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(character, "character");
        Objects.requireNonNull(workflowRef, "workflowRef");
        Objects.requireNonNull(seed, "seed");
        Objects.requireNonNull(destinationDir, "destinationDir");
        Objects.requireNonNull(destinationName, "destinationName");
    }

    /** Build a job whose identity is derived from its character and scene. */
    public static Job of(String character, String scene, String workflowRef,
                         Path seed, Path destinationDir) {
        String label = (scene != null && !scene.isBlank()) ? scene : workflowName(workflowRef);
        return new Job(character + "/" + label, character, scene, workflowRef,
                seed, destinationDir, label);
    }

    /**
     * Short workflow name used when a job has no scene:
     * {@code /any/dir/bj-api.json} becomes {@code bj}.
     */
    public static String workflowName(String workflowRef) {
        String name = workflowRef;
        int slash = name.lastIndexOf('/');
        if (slash >= 0) name = name.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        if (dot > 0) name = name.substring(0, dot);
        if (name.endsWith("-api")) name = name.substring(0, name.length() - 4);
        return name;
    }

    /** Scene name, or the derived workflow name for ad-hoc jobs. */
    public String sceneLabel() {
        return destinationName;
    }

    /** Destination path for an artifact with the given extension (including the dot). */
    public Path destinationFor(String extension) {
        return destinationDir.resolve(destinationName + extension);
    }
}

package com.genbatch.orchestrator.progress;

import com.genbatch.orchestrator.model.Job;

/** Descriptive fields copied into a ledger entry when a job starts. */
public record EntryMetadata(String character, String scene, String workflow) {

    public static EntryMetadata of(Job job) {
        return new EntryMetadata(job.character(), job.sceneLabel(), job.workflowRef());
    }
}

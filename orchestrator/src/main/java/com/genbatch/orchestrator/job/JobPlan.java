package com.genbatch.orchestrator.job;

import com.genbatch.orchestrator.model.CharacterAssets;
import com.genbatch.orchestrator.model.Job;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Result of planning a batch.
 *
 * @param characters the characters that were planned
 * @param scenes     the globally selected scenes
 * @param jobs       jobs in execution order
 * @param warnings   skipped combinations and selection problems; never fatal
 */
public record JobPlan(
        List<CharacterAssets> characters,
        List<String> scenes,
        List<Job> jobs,
        List<String> warnings) {

    public JobPlan {
        characters = List.copyOf(characters);
        scenes     = List.copyOf(scenes);
        jobs       = List.copyOf(jobs);
        warnings   = List.copyOf(warnings);
    }

    /** Distinct characters that have at least one job, in job order. */
    public Set<String> jobCharacters() {
        Set<String> names = new LinkedHashSet<>();
        jobs.forEach(j -> names.add(j.character()));
        return names;
    }

    public int size() {
        return jobs.size();
    }
}

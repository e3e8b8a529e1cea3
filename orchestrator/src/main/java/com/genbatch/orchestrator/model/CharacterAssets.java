package com.genbatch.orchestrator.model;

import java.nio.file.Path;
import java.util.Set;

/**
 * A character folder found under the batch directory.
 *
 * @param presentSeeds catalog seed file names that exist in {@code directory}
 */
public record CharacterAssets(String name, Path directory, Set<String> presentSeeds) {

    public CharacterAssets {
        presentSeeds = Set.copyOf(presentSeeds);
    }

    public boolean hasSeed(String seedFile) {
        return presentSeeds.contains(seedFile);
    }

    public Path seedPath(String seedFile) {
        return directory.resolve(seedFile);
    }
}

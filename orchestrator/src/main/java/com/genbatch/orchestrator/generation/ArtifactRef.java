package com.genbatch.orchestrator.generation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A file produced by a finished request, as listed in its completion record.
 *
 * @param kind storage area on the service ("output", "temp"); defaults to output
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArtifactRef(
        String filename,
        String subfolder,
        @JsonProperty("type") String kind) {

    public ArtifactRef {
        if (subfolder == null) subfolder = "";
        if (kind == null || kind.isBlank()) kind = "output";
    }

    /** File extension including the dot, or {@code fallback} if the name has none. */
    public String extensionOr(String fallback) {
        int dot = filename.lastIndexOf('.');
        int slash = filename.lastIndexOf('/');
        return dot > slash + 1 ? filename.substring(dot) : fallback;
    }

    /** Path relative to the service's storage root, e.g. {@code video/out_00001.mp4}. */
    public String relativePath() {
        return subfolder.isEmpty() ? filename : subfolder + "/" + filename;
    }
}

package com.genbatch.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of the batch manifest.
 *
 * @param outputPath artifact path relative to the batch output directory
 */
public record ManifestEntry(
        String character,
        String scene,
        @JsonProperty("file") String outputPath) {}

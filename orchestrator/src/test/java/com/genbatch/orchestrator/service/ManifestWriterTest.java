package com.genbatch.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genbatch.orchestrator.model.ManifestEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ManifestWriterTest {

    @TempDir Path outputDir;

    @Test
    void write_listsEntriesWithFileKey() throws Exception {
        ObjectMapper json = new ObjectMapper();

        Path file = new ManifestWriter(json).write(outputDir.resolve("out"), List.of(
                new ManifestEntry("ann", "idle", "ann/idle.mp4"),
                new ManifestEntry("ben", "walk", "ben/walk.webm")));

        assertThat(file.getFileName().toString()).isEqualTo("manifest.json");
        JsonNode root = json.readTree(file.toFile());
        assertThat(root).hasSize(2);
        assertThat(root.get(1).path("file").asText()).isEqualTo("ben/walk.webm");
        assertThat(root.get(0).has("outputPath")).isFalse();
    }
}

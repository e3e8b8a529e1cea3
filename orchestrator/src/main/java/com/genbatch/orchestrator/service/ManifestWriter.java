package com.genbatch.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genbatch.orchestrator.model.ManifestEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes {@code manifest.json}: the artifacts produced by a run. Written once
 * at the end; resume never reads it.
 */
@Component
public class ManifestWriter {

    private static final Logger log = LoggerFactory.getLogger(ManifestWriter.class);

    public static final String FILE_NAME = "manifest.json";

    private final ObjectMapper json;

    public ManifestWriter(ObjectMapper json) {
        this.json = json;
    }

    public Path write(Path outputDir, List<ManifestEntry> entries) {
        Path file = outputDir.resolve(FILE_NAME);
        try {
            Files.createDirectories(outputDir);
            json.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), entries);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }
        log.info("Manifest: {} ({} entries)", file, entries.size());
        return file;
    }
}

package com.genbatch.orchestrator.job;

import com.genbatch.orchestrator.model.Job;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Looks up artifacts already written for a job.
 *
 * The extension of an artifact is only known once it is produced, so any
 * regular file named {@code <destinationName>.<ext>} counts.
 */
public final class Destinations {

    private Destinations() {}

    public static Optional<Path> existing(Job job) {
        Path dir = job.destinationDir();
        if (!Files.isDirectory(dir)) return Optional.empty();
        try (DirectoryStream<Path> files =
                     Files.newDirectoryStream(dir, glob(job.destinationName()) + ".*")) {
            for (Path file : files) {
                if (Files.isRegularFile(file) && !file.getFileName().toString().endsWith(".part")) {
                    return Optional.of(file);
                }
            }
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + dir, e);
        }
    }

    private static String glob(String literal) {
        return literal.replaceAll("([*?\\[\\]{}\\\\])", "\\\\$1");
    }
}
